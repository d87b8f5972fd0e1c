package com.transitstat.analyzer.dto.analysis;

import java.util.EnumMap;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

/** Line counters for one run. Not part of the report. */
public class AnalysisSummary {

  private final Map<LineOutcome, Long> counts = new EnumMap<>(LineOutcome.class);

  @Getter @Setter private int filesScanned;

  @Getter @Setter private long processingTimeMs;

  public AnalysisSummary() {
    for (LineOutcome outcome : LineOutcome.values()) {
      counts.put(outcome, 0L);
    }
  }

  public void record(LineOutcome outcome) {
    counts.merge(outcome, 1L, Long::sum);
  }

  public long getCount(LineOutcome outcome) {
    return counts.get(outcome);
  }

  public long getLinesRead() {
    return counts.values().stream().mapToLong(Long::longValue).sum();
  }

  @Override
  public String toString() {
    return String.format(
        "files=%d, lines=%d, absorbed=%d, invalid=%d, unusual=%d, status-dropped=%d,"
            + " month-dropped=%d, malformed-request=%d, time=%dms",
        filesScanned,
        getLinesRead(),
        getCount(LineOutcome.ABSORBED),
        getCount(LineOutcome.INVALID),
        getCount(LineOutcome.UNUSUAL),
        getCount(LineOutcome.STATUS_DROPPED),
        getCount(LineOutcome.MONTH_DROPPED),
        getCount(LineOutcome.MALFORMED_REQUEST),
        processingTimeMs);
  }
}
