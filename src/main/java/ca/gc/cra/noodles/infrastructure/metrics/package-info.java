/**
 * OpenTelemetry implementation of the metrics port, exporting over OTLP gRPC or disabled.
 *
 * @since 0.1.0
 */
package ca.gc.cra.noodles.infrastructure.metrics;
