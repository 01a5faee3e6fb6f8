package ca.gc.cra.ingest.infrastructure.metrics;

import ca.gc.cra.ingest.application.port.MetricsPort;
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
 * Metrics adapter that forwards ingestion counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key. Names are lower-cased and restricted to letters, digits, dot,
 * underscore, and hyphen; the original key travels as the {@code ingest.metric.key} attribute.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("ingest.metric.key");
  private static final String FALLBACK_METRIC_NAME = "ingest.metric";

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;

  /**
   * Creates an adapter wired to the exporter selected by system properties or environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
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
  public void increment(String key, long delta) {
    if (delta > 0) {
      delegate.add(key, delta);
    }
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes pending exports and shuts the meter provider down.
   */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private interface MetricsDelegate {
    default void increment(String key) {
      add(key, 1);
    }

    void add(String key, long delta);

    void observe(String key, long value);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void add(String key, long delta) {
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
    public void add(String key, long delta) {
      String effectiveKey = Objects.requireNonNull(key, "key");
      CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
      instrument.counter().add(delta, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      String effectiveKey = Objects.requireNonNull(key, "key");
      HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
      instrument.histogram().record(value, instrument.attributes());
    }

    private CounterInstrument createCounter(String key) {
      String name = sanitizedNames.computeIfAbsent(key, OtelDelegate::sanitizeName);
      LongCounter counter = meter
          .counterBuilder(name)
          .setUnit("1")
          .setDescription("Ingestion counter for " + key)
          .build();
      if (!name.equals(key)) {
        log.debug("Sanitized counter name '{}' -> '{}'", key, name);
      }
      return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private HistogramInstrument createHistogram(String key) {
      String name = sanitizedNames.computeIfAbsent(key, OtelDelegate::sanitizeName);
      LongHistogram histogram = meter
          .histogramBuilder(name)
          .ofLongs()
          .setDescription("Ingestion observation for " + key)
          .build();
      if (!name.equals(key)) {
        log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
      }
      return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private static String sanitizeName(String key) {
      if (key == null || key.isBlank()) {
        return FALLBACK_METRIC_NAME;
      }
      String lower = key.trim().toLowerCase(Locale.ROOT);
      StringBuilder result = new StringBuilder(lower.length() + 1);
      if (!Character.isLetter(lower.charAt(0))) {
        result.append('m');
      }
      for (int i = 0; i < lower.length(); i++) {
        char c = lower.charAt(i);
        result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
      }
      return result.toString();
    }
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
