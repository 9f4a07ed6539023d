package eventmanager;

/**
 * Callback that reacts to an {@link Event}.
 *
 * <p>Handlers run <b>synchronously</b> on the thread calling
 * {@link eventmanager.dispatch.EventDispatcher#processEvents()}. A handler may push new
 * events; they are drained by the same {@code processEvents()} call.
 *
 * <h2>Error Handling</h2>
 * <p>What happens when a handler throws is decided by the dispatcher's
 * {@link eventmanager.dispatch.HandlerFailurePolicy}: either the failure is logged and the
 * remaining handlers still run, or the drain stops with a
 * {@link eventmanager.dispatch.HandlerInvocationException}.
 *
 * @see Handler
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Processes an event. The event must be treated as read-only.
   *
   * @param event the event being dispatched
   * @throws Exception if processing fails
   */
  void onEvent(Event event) throws Exception;
}
