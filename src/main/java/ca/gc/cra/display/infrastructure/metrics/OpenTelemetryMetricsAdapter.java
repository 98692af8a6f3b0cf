package ca.gc.cra.display.infrastructure.metrics;

import ca.gc.cra.display.application.port.MetricsPort;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards display counters and observations to an OpenTelemetry {@link Meter}.
 *
 * <p>Instruments are created lazily, one per key, and tagged with a {@code display.metric.key} attribute.
 * The adapter never configures an SDK or exporter; the hosting application owns that.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  /** Instrumentation scope registered with the meter provider. */
  public static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.display";
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("display.metric.key");

  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  public OpenTelemetryMetricsAdapter(Meter meter) {
    this.meter = Objects.requireNonNull(meter, "meter");
  }

  /**
   * Creates an adapter on the globally registered OpenTelemetry instance; a noop meter when none is registered.
   *
   * @return adapter bound to {@link GlobalOpenTelemetry}
   */
  public static OpenTelemetryMetricsAdapter fromGlobal() {
    return new OpenTelemetryMetricsAdapter(GlobalOpenTelemetry.getMeter(INSTRUMENTATION_SCOPE));
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, attributes(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value, attributes(key));
  }

  private LongCounter createCounter(String key) {
    log.debug("Registering display counter {}", key);
    return meter.counterBuilder(key)
        .setUnit("1")
        .setDescription("Display counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    log.debug("Registering display histogram {}", key);
    return meter.histogramBuilder(key)
        .ofLongs()
        .setDescription("Display observation for " + key)
        .build();
  }

  private static Attributes attributes(String key) {
    return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
  }
}
