package com.transitstat.analyzer.service.aggregation;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.transitstat.analyzer.dto.analysis.CanonicalDay;
import com.transitstat.analyzer.dto.analysis.ClassifiedRequest;

/**
 * Per-day totals for one run, keyed by the yyyy/MM/dd date string. Records may arrive in any
 * order; every absorbed record is counted, duplicates included.
 *
 * <p>Not thread-safe. Shards processed separately can be combined with {@link #merge}.
 */
public class DailyAggregator {

  private final Map<String, DayBucket> buckets = new HashMap<>();

  public void absorb(CanonicalDay day, ClassifiedRequest request) {
    buckets.computeIfAbsent(day.getKey(), key -> new DayBucket(key, day.getWeekday())).add(request);
  }

  /** Adds all of {@code other}'s totals into this aggregator. {@code other} is left unchanged. */
  public DailyAggregator merge(DailyAggregator other) {
    for (DayBucket theirs : other.buckets.values()) {
      buckets
          .computeIfAbsent(theirs.getDate(), key -> new DayBucket(key, theirs.getWeekday()))
          .add(theirs);
    }
    return this;
  }

  public DayBucket get(String dateKey) {
    return buckets.get(dateKey);
  }

  public Collection<DayBucket> buckets() {
    return Collections.unmodifiableCollection(buckets.values());
  }

  public int size() {
    return buckets.size();
  }

  public boolean isEmpty() {
    return buckets.isEmpty();
  }
}
