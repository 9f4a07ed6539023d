package eventmanager.spring.boot;

import eventmanager.EventType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a handler registered with the {@link eventmanager.dispatch.EventDispatcher}.
 *
 * <p>The annotated bean must implement {@link eventmanager.EventHandler}.
 *
 * <h2>String-based registration</h2>
 * <pre>{@code
 * @Component
 * @EventSubscriber(eventType = "PlayerJoined", priority = 10)
 * public class Greeter implements EventHandler {
 *   public void onEvent(Event event) { ... }
 * }
 * }</pre>
 *
 * <h2>Type-safe class-based registration</h2>
 * <pre>{@code
 * @Component
 * @EventSubscriber(eventTypeClass = PlayerEvents.class, eventType = "PLAYER_LEFT")
 * public class Farewell implements EventHandler { ... }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>A non-enum {@code eventTypeClass} takes precedence over {@code eventType}</li>
 *   <li>An enum {@code eventTypeClass} with several constants needs {@code eventType} to
 *       name the constant; a single-constant enum may omit it</li>
 *   <li>At least one of {@code eventType}/{@code eventTypeClass} must be specified</li>
 *   <li>The handler key defaults to the bean name</li>
 * </ul>
 *
 * @see EventSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventSubscriber {

    /**
     * Event type name (string-based).
     */
    String eventType() default "";

    /**
     * Event type class (type-safe). Must have a no-arg constructor or be an enum. For an
     * enum, {@link #eventType()} selects the constant.
     */
    Class<? extends EventType> eventTypeClass() default EventType.class;

    /**
     * Handler priority; higher runs first.
     */
    int priority() default 0;

    /**
     * Handler identity key breaking ties between equal priorities. Defaults to the bean name.
     */
    String key() default "";
}
