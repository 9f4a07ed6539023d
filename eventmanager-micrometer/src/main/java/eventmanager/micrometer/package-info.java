/**
 * Micrometer integration for dispatcher metrics.
 *
 * <p>{@link eventmanager.micrometer.MicrometerMetricsExporter} implements
 * {@link eventmanager.spi.MetricsExporter} by registering counters and a queue-depth gauge
 * with a {@code MeterRegistry}.
 *
 * @see eventmanager.micrometer.MicrometerMetricsExporter
 */
package eventmanager.micrometer;
