package ca.gc.cra.pulse.domain.stats;

import ca.gc.cra.pulse.domain.util.Rounding;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a ranked breakdown (browser, OS, device, source, medium, page, country, ...).
 *
 * @param label breakdown label; never {@code null}
 * @param count number of occurrences
 * @param percentage share of the total, rounded to one decimal
 *
 * @since 0.1.0
 */
public record RankedCount(String label, long count, double percentage) {

  /**
   * Validates constructor invariants.
   */
  public RankedCount {
    label = Objects.requireNonNull(label, "label");
  }

  /**
   * Ranks label occurrences by count, descending.
   *
   * <p>Labels with equal counts keep their first-seen order. Percentages are computed against
   * {@code total}, which lets callers rank a subset (e.g. campaigns) against the full population.</p>
   *
   * @param labels labels in encounter order; {@code null} entries are ignored
   * @param total denominator for the percentage column
   * @return ranked rows; empty when {@code labels} is empty
   */
  public static List<RankedCount> rank(Iterable<String> labels, long total) {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (String label : labels) {
      if (label != null) {
        counts.merge(label, 1L, Long::sum);
      }
    }
    List<RankedCount> rows = new ArrayList<>(counts.size());
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      rows.add(new RankedCount(entry.getKey(), entry.getValue(), Rounding.percentage(entry.getValue(), total)));
    }
    rows.sort(Comparator.comparingLong(RankedCount::count).reversed());
    return List.copyOf(rows);
  }

  /**
   * Ranks labels using their own count as the denominator.
   *
   * @param labels labels in encounter order
   * @return ranked rows
   */
  public static List<RankedCount> rank(List<String> labels) {
    return rank(labels, labels.size());
  }
}
