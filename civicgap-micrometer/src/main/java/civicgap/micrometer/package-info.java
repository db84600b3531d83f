/**
 * Micrometer bridge for {@link civicgap.spi.MetricsExporter}.
 */
package civicgap.micrometer;
