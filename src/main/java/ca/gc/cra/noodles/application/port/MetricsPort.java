package ca.gc.cra.noodles.application.port;

/**
 * <strong>What:</strong> Port abstracting replication-server metrics emission.
 * <p><strong>Why:</strong> Lets the transport and the dispatch pipeline count events and record sizes without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * embedded use.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls from the accept loop, client
 * readers, the dispatcher and the tick thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code dispatch.envelope.sent},
 * {@code tick.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g., {@code ws.handshake.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value such as nanoseconds or bytes
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
