package ca.gc.cra.pulse.infrastructure.json;

import ca.gc.cra.pulse.application.summary.DashboardSummary;
import ca.gc.cra.pulse.domain.metrics.AnomalyReport;
import ca.gc.cra.pulse.domain.metrics.MetricsSummary;
import ca.gc.cra.pulse.domain.metrics.PerformanceMetrics;
import ca.gc.cra.pulse.domain.stats.RankedCount;
import ca.gc.cra.pulse.domain.time.AggregatedBucket;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Serializes a {@link DashboardSummary} to the JSON document returned by the dashboard API.
 * <p><strong>Why:</strong> Streams through Jackson's {@link JsonGenerator} so field names and null handling stay
 * fixed regardless of record layout.</p>
 * <p><strong>Role:</strong> Outbound adapter; the HTTP layer writes the bytes as-is.</p>
 * <p><strong>Thread-safety:</strong> The shared {@link JsonFactory} is thread-safe; each call owns its
 * generator.</p>
 *
 * @since 0.1.0
 */
public final class DashboardSummaryJsonWriter {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Renders the summary as a UTF-8 JSON string.
   *
   * @param summary summary to render; must not be {@code null}
   * @return JSON document
   */
  public String toJson(DashboardSummary summary) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      write(summary, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render dashboard summary", ex);
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  /**
   * Streams the summary to {@code out}. The stream is flushed but not closed.
   *
   * @param summary summary to render; must not be {@code null}
   * @param out destination stream
   * @throws IOException when writing fails
   */
  public void write(DashboardSummary summary, OutputStream out) throws IOException {
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.writeStartObject();
      writeTotals(gen, summary.totals());
      writeRanked(gen, "pages", summary.pages());
      writeRanked(gen, "sources", summary.sources());
      writeRanked(gen, "mediums", summary.mediums());
      writeRanked(gen, "devices", summary.devices());
      writeRanked(gen, "browsers", summary.browsers());
      writeRanked(gen, "operatingSystems", summary.operatingSystems());
      writeRanked(gen, "countries", summary.countries());
      writeRanked(gen, "languages", summary.languages());
      writeRanked(gen, "campaigns", summary.campaigns());
      writeRanked(gen, "events", summary.events());
      gen.writeStringField("granularity", summary.granularity().toString());
      writeSeries(gen, summary.series());
      writeAnomalies(gen, summary.anomalies());
      gen.writeNumberField("returnVisitorRate", summary.returnVisitorRate());
      gen.writeNumberField("sessionQuality", summary.sessionQuality());
      writePerformance(gen, summary.sessionDuration());
      gen.writeNumberField("mobilePercentage", summary.mobilePercentage());
      gen.writeNumberField("botsFiltered", summary.botsFiltered());
      gen.writeEndObject();
    }
    out.flush();
  }

  private static void writeTotals(JsonGenerator gen, MetricsSummary totals) throws IOException {
    gen.writeObjectFieldStart("totals");
    gen.writeNumberField("totalPageViews", totals.totalPageViews());
    gen.writeNumberField("uniqueVisitors", totals.uniqueVisitors());
    gen.writeNumberField("totalSessions", totals.totalSessions());
    gen.writeNumberField("bounceRate", totals.bounceRate());
    gen.writeNumberField("avgSessionDuration", totals.avgSessionDuration());
    gen.writeNumberField("avgPageViewsPerSession", totals.avgPageViewsPerSession());
    if (totals.conversionRate() == null) {
      gen.writeNullField("conversionRate");
    } else {
      gen.writeNumberField("conversionRate", totals.conversionRate());
    }
    gen.writeEndObject();
  }

  private static void writeRanked(JsonGenerator gen, String field, List<RankedCount> rows) throws IOException {
    gen.writeArrayFieldStart(field);
    for (RankedCount row : rows) {
      gen.writeStartObject();
      gen.writeStringField("label", row.label());
      gen.writeNumberField("count", row.count());
      gen.writeNumberField("percentage", row.percentage());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeSeries(JsonGenerator gen, List<AggregatedBucket> series) throws IOException {
    gen.writeArrayFieldStart("series");
    for (AggregatedBucket bucket : series) {
      gen.writeStartObject();
      gen.writeStringField("period", bucket.period());
      gen.writeNumberField("pageViews", bucket.pageViews());
      gen.writeNumberField("uniqueVisitors", bucket.uniqueVisitors());
      gen.writeNumberField("sessions", bucket.sessions());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeAnomalies(JsonGenerator gen, AnomalyReport report) throws IOException {
    gen.writeObjectFieldStart("anomalies");
    gen.writeArrayFieldStart("values");
    for (double value : report.anomalies()) {
      gen.writeNumber(value);
    }
    gen.writeEndArray();
    gen.writeNumberField("mean", report.mean());
    gen.writeNumberField("stdDev", report.stdDev());
    gen.writeEndObject();
  }

  private static void writePerformance(JsonGenerator gen, PerformanceMetrics metrics) throws IOException {
    gen.writeObjectFieldStart("sessionDuration");
    gen.writeStringField("metric", metrics.metric());
    gen.writeNumberField("value", metrics.value());
    gen.writeNumberField("p50", metrics.p50());
    gen.writeNumberField("p75", metrics.p75());
    gen.writeNumberField("p95", metrics.p95());
    gen.writeEndObject();
  }
}
