package ca.gc.cra.pulse.domain.metrics;

/**
 * Visitors with exactly one session versus visitors with several.
 *
 * @param newVisitors visitors seen in a single session
 * @param returningVisitors visitors seen in more than one session
 *
 * @since 0.1.0
 */
public record VisitorRatio(long newVisitors, long returningVisitors) {

  public long total() {
    return newVisitors + returningVisitors;
  }
}
