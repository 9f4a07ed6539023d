package eventmanager.dispatch;

import eventmanager.Event;

import java.util.Objects;

/**
 * Cross-cutting hook for observing event dispatch.
 *
 * <p>Interceptors run around the handler set of each event:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>Interceptors also run for events whose type has no handlers. If
 * {@code beforeDispatch} throws, the handlers of that event are skipped and the failure is
 * treated like a handler failure. {@code afterDispatch} exceptions are logged but
 * swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventDispatcher.builder()
 *     .interceptor(EventInterceptor.of(
 *         event -> timer.start(event.eventId()),
 *         (event, error) -> timer.stop(event.eventId(), error == null)))
 *     .build();
 * }</pre>
 */
public interface EventInterceptor {

    /**
     * Called before the handlers of the event are invoked.
     *
     * @param event the event about to be dispatched
     * @throws Exception to skip the handlers of this event
     */
    default void beforeDispatch(Event event) throws Exception {
    }

    /**
     * Called after the handlers ran (or after a beforeDispatch failure).
     *
     * @param event the event that was dispatched
     * @param error null on success, otherwise the last failure seen for this event
     */
    default void afterDispatch(Event event, Exception error) {
    }

    /**
     * Combines a before and an after hook into one interceptor, so that both sides share
     * one position in the interceptor order. Either hook may be null.
     */
    static EventInterceptor of(BeforeDispatch before, AfterDispatch after) {
        return new EventInterceptor() {
            @Override
            public void beforeDispatch(Event event) throws Exception {
                if (before != null) {
                    before.accept(event);
                }
            }

            @Override
            public void afterDispatch(Event event, Exception error) {
                if (after != null) {
                    after.accept(event, error);
                }
            }
        };
    }

    static EventInterceptor before(BeforeDispatch hook) {
        return of(Objects.requireNonNull(hook, "hook"), null);
    }

    static EventInterceptor after(AfterDispatch hook) {
        return of(null, Objects.requireNonNull(hook, "hook"));
    }

    /** Hook run before the handlers of an event; throwing skips them. */
    @FunctionalInterface
    interface BeforeDispatch {
        void accept(Event event) throws Exception;
    }

    /** Hook run once the handlers of an event are done. */
    @FunctionalInterface
    interface AfterDispatch {
        void accept(Event event, Exception error);
    }
}
