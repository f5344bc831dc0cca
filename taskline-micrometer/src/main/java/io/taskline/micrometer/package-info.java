/**
 * Micrometer bridge for exporting scheduler and credential metrics.
 *
 * <p>{@link io.taskline.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.taskline.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 */
package io.taskline.micrometer;
