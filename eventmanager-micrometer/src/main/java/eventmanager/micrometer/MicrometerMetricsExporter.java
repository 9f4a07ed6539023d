package eventmanager.micrometer;

import eventmanager.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventmanager.events.pushed} — events accepted by {@code pushEvent}</li>
 *   <li>{@code eventmanager.events.dispatched} — events whose handlers were invoked</li>
 *   <li>{@code eventmanager.events.unhandled} — events dropped, no handler for their type</li>
 *   <li>{@code eventmanager.events.discarded} — pending events discarded without dispatch</li>
 *   <li>{@code eventmanager.handler.invocations} — individual handler calls</li>
 *   <li>{@code eventmanager.handler.failures} — handler calls that threw</li>
 *   <li>{@code eventmanager.interceptor.failures} — beforeDispatch calls that threw</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventmanager.queue.depth} — current pending-event count</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsPushed;
  private final Counter eventsDispatched;
  private final Counter eventsUnhandled;
  private final Counter eventsDiscarded;
  private final Counter handlerInvocations;
  private final Counter handlerFailures;
  private final Counter interceptorFailures;
  private final Gauge queueDepthGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventmanager"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventmanager");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "game.events"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsPushed = Counter.builder(namePrefix + ".events.pushed")
        .description("Events accepted by pushEvent")
        .register(registry);
    this.eventsDispatched = Counter.builder(namePrefix + ".events.dispatched")
        .description("Events whose handlers were invoked")
        .register(registry);
    this.eventsUnhandled = Counter.builder(namePrefix + ".events.unhandled")
        .description("Events dropped with no handler for their type")
        .register(registry);
    this.eventsDiscarded = Counter.builder(namePrefix + ".events.discarded")
        .description("Pending events discarded without dispatch")
        .register(registry);
    this.handlerInvocations = Counter.builder(namePrefix + ".handler.invocations")
        .description("Handler invocations")
        .register(registry);
    this.handlerFailures = Counter.builder(namePrefix + ".handler.failures")
        .description("Handler invocations that threw")
        .register(registry);
    this.interceptorFailures = Counter.builder(namePrefix + ".interceptor.failures")
        .description("Interceptor beforeDispatch calls that threw, skipping the event's handlers")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementEventsPushed() {
    if (closed) return;
    eventsPushed.increment();
  }

  @Override
  public void incrementEventsDispatched() {
    if (closed) return;
    eventsDispatched.increment();
  }

  @Override
  public void incrementEventsUnhandled() {
    if (closed) return;
    eventsUnhandled.increment();
  }

  @Override
  public void incrementEventsDiscarded(int count) {
    if (closed) return;
    eventsDiscarded.increment(count);
  }

  @Override
  public void incrementHandlerInvocations() {
    if (closed) return;
    handlerInvocations.increment();
  }

  @Override
  public void incrementHandlerFailures() {
    if (closed) return;
    handlerFailures.increment();
  }

  @Override
  public void incrementInterceptorFailures() {
    if (closed) return;
    interceptorFailures.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the dispatcher is discarded to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsPushed, eventsDispatched, eventsUnhandled,
        eventsDiscarded, handlerInvocations, handlerFailures, interceptorFailures, queueDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
