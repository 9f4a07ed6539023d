package eventmanager.spring.boot;

import eventmanager.dispatch.HandlerFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event dispatcher.
 *
 * @see EventManagerAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventmanager")
public class EventManagerProperties {

    private final Dispatcher dispatcher = new Dispatcher();
    private final Metrics metrics = new Metrics();

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatcher {
        /**
         * Maximum number of events one processEvents() call may dispatch; 0 means unbounded.
         */
        private int maxEventsPerDrain = 0;

        /**
         * What to do when a handler throws.
         */
        private HandlerFailurePolicy failurePolicy = HandlerFailurePolicy.CONTINUE;

        public int getMaxEventsPerDrain() {
            return maxEventsPerDrain;
        }

        public void setMaxEventsPerDrain(int maxEventsPerDrain) {
            this.maxEventsPerDrain = maxEventsPerDrain;
        }

        public HandlerFailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(HandlerFailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventmanager";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
