package ca.gc.cra.display.application.port;

/**
 * <strong>What:</strong> Port abstracting display metrics emission.
 * <p><strong>Why:</strong> Lets the print engine count emitted, suppressed, truncated and failed prints and
 * record lock contention without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} is the default.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every printing thread.</p>
 * <p><strong>Performance:</strong> Calls happen inside the display lock and must not block.</p>
 *
 * @implNote Metric keys use dotted naming such as {@code display.print.emitted}; never {@code null}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value, in units defined by the key (e.g. {@code waitNanos})
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
