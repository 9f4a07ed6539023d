/**
 * Service provider interfaces for plugging the dispatcher into external systems.
 *
 * @see eventmanager.spi.MetricsExporter
 */
package eventmanager.spi;
