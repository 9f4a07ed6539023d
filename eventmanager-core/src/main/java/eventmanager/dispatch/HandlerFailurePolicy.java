package eventmanager.dispatch;

/**
 * What {@link EventDispatcher#processEvents()} does when a handler or an interceptor's
 * {@code beforeDispatch} throws.
 */
public enum HandlerFailurePolicy {
  /** Log the failure and keep invoking the remaining handlers. */
  CONTINUE,
  /**
   * Discard the failing event and stop the drain with a {@link HandlerInvocationException}.
   * Events still pending stay queued.
   */
  PROPAGATE
}
