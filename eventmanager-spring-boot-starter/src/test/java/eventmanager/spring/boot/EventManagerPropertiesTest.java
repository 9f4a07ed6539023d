package eventmanager.spring.boot;

import eventmanager.dispatch.HandlerFailurePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventManagerPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(EventManagerProperties.class);
            assertEquals(0, props.getDispatcher().getMaxEventsPerDrain());
            assertEquals(HandlerFailurePolicy.CONTINUE, props.getDispatcher().getFailurePolicy());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("eventmanager", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "eventmanager.dispatcher.max-events-per-drain=250",
                "eventmanager.dispatcher.failure-policy=PROPAGATE",
                "eventmanager.metrics.enabled=false",
                "eventmanager.metrics.name-prefix=game.events"
        ).run(ctx -> {
            var props = ctx.getBean(EventManagerProperties.class);
            assertEquals(250, props.getDispatcher().getMaxEventsPerDrain());
            assertEquals(HandlerFailurePolicy.PROPAGATE, props.getDispatcher().getFailurePolicy());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("game.events", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(EventManagerProperties.class)
    static class PropsConfig {
    }
}
