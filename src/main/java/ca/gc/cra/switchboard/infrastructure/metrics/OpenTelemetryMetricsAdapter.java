package ca.gc.cra.switchboard.infrastructure.metrics;

import ca.gc.cra.switchboard.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards bus counters and histograms to OpenTelemetry.
 *
 * <p>Each dotted key ({@code router.message.delivered}) becomes one instrument, tagged with the original key under
 * {@code switchboard.metric.key}.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("switchboard.metric.key");
  private static final String FALLBACK_METRIC_NAME = "switchboard.metric";

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize(null));
  }

  /**
   * Creates an adapter for an explicit exporter choice ({@code otlp} or {@code none}).
   *
   * @param exporter exporter name; {@code null} defers to system properties and environment
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key) {
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes and shuts down the meter provider.
   */
  @Override
  public void close() {
    bootstrap.close();
  }

  private interface MetricsDelegate {
    void increment(String key);

    void observe(String key, long value);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void increment(String key) {
      // no-op
    }

    @Override
    public void observe(String key, long value) {
      // no-op
    }
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();
    private final Map<String, String> sanitizedNames = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      String effectiveKey = Objects.requireNonNull(key, "key");
      CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
      instrument.counter().add(1, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      String effectiveKey = Objects.requireNonNull(key, "key");
      HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
      instrument.histogram().record(value, instrument.attributes());
    }

    private CounterInstrument createCounter(String key) {
      String sanitized = sanitizedNames.computeIfAbsent(key, OtelDelegate::sanitizeName);
      LongCounter counter = meter
          .counterBuilder(sanitized)
          .setUnit("1")
          .setDescription("Bus counter for " + key)
          .build();
      if (!sanitized.equals(key)) {
        log.debug("Sanitized counter name '{}' -> '{}'", key, sanitized);
      }
      return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private HistogramInstrument createHistogram(String key) {
      String sanitized = sanitizedNames.computeIfAbsent(key, OtelDelegate::sanitizeName);
      LongHistogram histogram = meter
          .histogramBuilder(sanitized)
          .ofLongs()
          .setDescription("Bus observation for " + key)
          .build();
      if (!sanitized.equals(key)) {
        log.debug("Sanitized histogram name '{}' -> '{}'", key, sanitized);
      }
      return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    // Instrument names are lowercase; router keys such as cycleDropped keep their spelling in the attribute.
    static String sanitizeName(String key) {
      if (key == null || key.isBlank()) {
        return FALLBACK_METRIC_NAME;
      }
      String lower = key.trim().toLowerCase(Locale.ROOT);
      StringBuilder result = new StringBuilder(lower.length() + 4);
      if (!Character.isLetter(lower.charAt(0))) {
        result.append('m');
      }
      for (int i = 0; i < lower.length(); i++) {
        char c = lower.charAt(i);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
          result.append(c);
        } else {
          result.append('_');
        }
      }
      return result.toString();
    }
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
