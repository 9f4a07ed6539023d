package eventmanager.spi;

/**
 * Observability hook for exporting dispatcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events accepted by {@code pushEvent}.
     */
    void incrementEventsPushed();

    /**
     * Increments the count of events whose handler set was invoked.
     */
    void incrementEventsDispatched();

    /**
     * Increments the count of events dropped because no handler was registered for their type.
     */
    void incrementEventsUnhandled();

    /**
     * Increments the count of pending events discarded without dispatch (clear or close).
     *
     * @param count number of events discarded
     */
    default void incrementEventsDiscarded(int count) {
    }

    /**
     * Increments the count of individual handler invocations.
     */
    default void incrementHandlerInvocations() {
    }

    /**
     * Increments the count of handler invocations that threw.
     */
    void incrementHandlerFailures();

    /**
     * Increments the count of interceptor {@code beforeDispatch} calls that threw and so
     * skipped the handlers of an event.
     */
    default void incrementInterceptorFailures() {
    }

    /**
     * Records the current depth of the pending-event queue.
     *
     * @param depth number of pending events
     */
    void recordQueueDepth(int depth);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsPushed() {
        }

        @Override
        public void incrementEventsDispatched() {
        }

        @Override
        public void incrementEventsUnhandled() {
        }

        @Override
        public void incrementHandlerFailures() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
