package eventmanager.dispatch;

import eventmanager.Event;
import eventmanager.Handler;

/**
 * Thrown by {@link EventDispatcher#processEvents()} under
 * {@link HandlerFailurePolicy#PROPAGATE} when a handler fails.
 *
 * <p>The cause is the exception thrown by the handler. {@link #handler()} is {@code null}
 * when the failure came from an interceptor's {@code beforeDispatch}.
 */
public class HandlerInvocationException extends RuntimeException {

  private final transient Event event;
  private final transient Handler handler;

  public HandlerInvocationException(Event event, Handler handler, Throwable cause) {
    super(describe(event, handler), cause);
    this.event = event;
    this.handler = handler;
  }

  private static String describe(Event event, Handler handler) {
    String source = handler == null ? "interceptor" : "handler " + handler.key();
    return "Dispatch of event " + event.eventId() + " (type " + event.type()
        + ") failed in " + source;
  }

  public Event event() {
    return event;
  }

  public Handler handler() {
    return handler;
  }
}
