package com.transitstat.analyzer.service.report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.transitstat.analyzer.dto.report.AccessReport;
import com.transitstat.analyzer.dto.report.Weekday;
import com.transitstat.analyzer.service.aggregation.DayBucket;

@Service
public class ReportBuilderService {

  /**
   * Builds the monthly report. Days are visited in ascending date order, which for yyyy/MM/dd keys
   * is plain string order.
   */
  public AccessReport build(Collection<DayBucket> buckets) {
    List<DayBucket> sorted = new ArrayList<>(buckets);
    sorted.sort(Comparator.comparing(DayBucket::getDate));

    Map<String, Long> weekdayStat = new LinkedHashMap<>();
    for (Weekday weekday : Weekday.values()) {
      weekdayStat.put(weekday.getDisplayName(), 0L);
    }
    Map<String, Long> dailyStat = new LinkedHashMap<>();

    long total = 0;
    long route = 0;
    long diagram = 0;
    long fare = 0;

    for (DayBucket bucket : sorted) {
      weekdayStat.merge(bucket.getWeekday().getDisplayName(), bucket.getEffective(), Long::sum);
      dailyStat.put(bucket.getDate(), bucket.getEffective());

      total += bucket.getEffective();
      route += bucket.getRoute();
      diagram += bucket.getDiagram();
      fare += bucket.getFare();
    }

    return AccessReport.builder()
        .totalStat(total)
        .routeStat(route)
        .diagramStat(diagram)
        .fareStat(fare)
        .weekdayStat(Collections.unmodifiableMap(weekdayStat))
        .dailyStat(Collections.unmodifiableMap(dailyStat))
        .build();
  }
}
