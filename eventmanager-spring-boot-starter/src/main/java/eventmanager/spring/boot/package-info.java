/**
 * Spring Boot auto-configuration for the event dispatcher.
 *
 * <p>Provides an {@link eventmanager.dispatch.EventDispatcher} bean configured from
 * {@code eventmanager.*} properties, optional Micrometer metrics, and registration of beans
 * annotated with {@link eventmanager.spring.boot.EventSubscriber}.
 *
 * @see eventmanager.spring.boot.EventManagerAutoConfiguration
 * @see eventmanager.spring.boot.EventManagerProperties
 */
package eventmanager.spring.boot;
