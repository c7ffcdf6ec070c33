package ca.gc.cra.pulse.config;

import ca.gc.cra.pulse.validation.Numbers;
import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable tuning knobs of the analytics engine.
 * <p><strong>Why:</strong> Keeps week boundaries, anomaly sensitivity, bot handling and metric export in one
 * validated value so every component of a deployment agrees on them.</p>
 * <p><strong>Role:</strong> Input of {@link CompositionRoot}; usually produced by {@link #fromMap(Map)} over the
 * output of {@link YamlConfigLoader}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param weekStart first day of week buckets; {@link DayOfWeek#SUNDAY} or {@link DayOfWeek#MONDAY}
 * @param anomalyThreshold z-score above which a series value is anomalous; non-negative
 * @param topLimit rows kept in each ranked breakdown of the dashboard summary; non-negative
 * @param excludeBots whether bot traffic is removed before any statistic is computed
 * @param fillGaps whether summary series get zero buckets for quiet periods
 * @param metricsExporter metric export mode
 * @param metricsEndpoint OTLP endpoint used when exporting
 * @param resourceAttributes extra OpenTelemetry resource attributes as {@code k=v[,k=v]}; may be blank
 * @param verboseLogging whether the PULSE loggers run at DEBUG
 *
 * @since 0.1.0
 */
public record EngineConfig(
    DayOfWeek weekStart,
    double anomalyThreshold,
    int topLimit,
    boolean excludeBots,
    boolean fillGaps,
    MetricsExporter metricsExporter,
    String metricsEndpoint,
    String resourceAttributes,
    boolean verboseLogging) {

  public static final String WEEK_START = "week.start";
  public static final String ANOMALY_THRESHOLD = "anomaly.threshold";
  public static final String TOP_LIMIT = "top.limit";
  public static final String BOTS_EXCLUDE = "bots.exclude";
  public static final String SERIES_FILL_GAPS = "series.fillGaps";
  public static final String METRICS_EXPORTER = "metrics.exporter";
  public static final String METRICS_ENDPOINT = "metrics.endpoint";
  public static final String METRICS_RESOURCE_ATTRIBUTES = "metrics.resourceAttributes";
  public static final String LOGGING_VERBOSE = "logging.verbose";

  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  private static final Set<DayOfWeek> WEEK_STARTS = Set.of(DayOfWeek.SUNDAY, DayOfWeek.MONDAY);

  /**
   * Validates constructor invariants.
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public EngineConfig {
    Objects.requireNonNull(weekStart, "weekStart");
    if (!WEEK_STARTS.contains(weekStart)) {
      throw new IllegalArgumentException("weekStart must be SUNDAY or MONDAY (was " + weekStart + ")");
    }
    Numbers.requireNonNegative("anomalyThreshold", anomalyThreshold);
    Numbers.requireNonNegative("topLimit", topLimit);
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    metricsEndpoint = Objects.requireNonNull(metricsEndpoint, "metricsEndpoint").trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Returns the defaults: Sunday weeks, threshold 2, top 10, bots excluded, gaps filled, no metric export.
   *
   * @return default configuration
   */
  public static EngineConfig defaults() {
    return new EngineConfig(
        DayOfWeek.SUNDAY, 2.0, 10, true, true, MetricsExporter.NONE, DEFAULT_ENDPOINT, "", false);
  }

  /**
   * Builds a configuration from flat dotted keys; missing keys keep their defaults.
   *
   * @param values flat key/value map, e.g. from {@link YamlConfigLoader}; must not be {@code null}
   * @return parsed configuration
   * @throws IllegalArgumentException if a present value cannot be parsed or is out of range
   */
  public static EngineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    EngineConfig base = defaults();
    return new EngineConfig(
        value(values, WEEK_START).map(EngineConfig::parseWeekStart).orElse(base.weekStart()),
        value(values, ANOMALY_THRESHOLD)
            .map(v -> parseDouble(ANOMALY_THRESHOLD, v))
            .orElse(base.anomalyThreshold()),
        value(values, TOP_LIMIT).map(v -> parseInt(TOP_LIMIT, v)).orElse(base.topLimit()),
        value(values, BOTS_EXCLUDE).map(v -> parseBoolean(BOTS_EXCLUDE, v)).orElse(base.excludeBots()),
        value(values, SERIES_FILL_GAPS).map(v -> parseBoolean(SERIES_FILL_GAPS, v)).orElse(base.fillGaps()),
        value(values, METRICS_EXPORTER).map(MetricsExporter::parse).orElse(base.metricsExporter()),
        value(values, METRICS_ENDPOINT).orElse(base.metricsEndpoint()),
        value(values, METRICS_RESOURCE_ATTRIBUTES).orElse(base.resourceAttributes()),
        value(values, LOGGING_VERBOSE).map(v -> parseBoolean(LOGGING_VERBOSE, v)).orElse(base.verboseLogging()));
  }

  private static Optional<String> value(Map<String, String> values, String key) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(raw.trim());
  }

  private static DayOfWeek parseWeekStart(String raw) {
    try {
      return DayOfWeek.valueOf(raw.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(WEEK_START + " must be sunday or monday (was " + raw + ")", ex);
    }
  }

  private static double parseDouble(String key, String raw) {
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  private static int parseInt(String key, String raw) {
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(String key, String raw) {
    String normalized = raw.toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
  }

  /** Metric export mode. */
  public enum MetricsExporter {
    NONE,
    OTLP;

    /**
     * Parses {@code none} or {@code otlp}, case-insensitively.
     *
     * @param raw configured value
     * @return export mode
     * @throws IllegalArgumentException for any other value
     */
    public static MetricsExporter parse(String raw) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException(
            METRICS_EXPORTER + " must be none or otlp (was " + raw + ")");
      };
    }
  }
}
