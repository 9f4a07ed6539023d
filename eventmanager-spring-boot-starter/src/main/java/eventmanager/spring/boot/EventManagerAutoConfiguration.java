package eventmanager.spring.boot;

import eventmanager.dispatch.EventDispatcher;
import eventmanager.dispatch.EventInterceptor;
import eventmanager.registry.DefaultHandlerRegistry;
import eventmanager.registry.HandlerRegistry;
import eventmanager.spi.MetricsExporter;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the event dispatcher.
 *
 * <p>Creates an {@link EventDispatcher} from {@link EventManagerProperties}, wiring in any
 * {@link MetricsExporter} and {@link EventInterceptor} beans, and registers beans annotated
 * with {@link EventSubscriber}.
 *
 * <p>The dispatcher is not thread-safe; the application decides which thread pushes and
 * drains events.
 *
 * @see EventManagerProperties
 * @see EventManagerMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(EventDispatcher.class)
@EnableConfigurationProperties(EventManagerProperties.class)
public class EventManagerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public HandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventDispatcher eventDispatcher(EventManagerProperties props,
      HandlerRegistry handlerRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<EventInterceptor> interceptorProvider) {

    List<EventInterceptor> interceptors = interceptorProvider.orderedStream().toList();
    var builder = EventDispatcher.builder()
        .registry(handlerRegistry)
        .interceptors(interceptors)
        .failurePolicy(props.getDispatcher().getFailurePolicy())
        .maxEventsPerDrain(props.getDispatcher().getMaxEventsPerDrain());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriberRegistrar eventSubscriberRegistrar(
      ListableBeanFactory beanFactory, EventDispatcher eventDispatcher) {
    return new EventSubscriberRegistrar(beanFactory, eventDispatcher);
  }
}
