package ca.gc.cra.pulse.domain.time;

/**
 * Selects one count from a bucket, e.g. for rolling averages.
 *
 * @since 0.1.0
 */
public enum BucketMetric {
  PAGE_VIEWS {
    @Override
    public long of(AggregatedBucket bucket) {
      return bucket.pageViews();
    }
  },
  UNIQUE_VISITORS {
    @Override
    public long of(AggregatedBucket bucket) {
      return bucket.uniqueVisitors();
    }
  },
  SESSIONS {
    @Override
    public long of(AggregatedBucket bucket) {
      return bucket.sessions();
    }
  };

  /**
   * Reads this metric from a bucket.
   *
   * @param bucket source bucket
   * @return selected count
   */
  public abstract long of(AggregatedBucket bucket);
}
