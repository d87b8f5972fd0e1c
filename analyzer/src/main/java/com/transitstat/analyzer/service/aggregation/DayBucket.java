package com.transitstat.analyzer.service.aggregation;

import com.transitstat.analyzer.dto.analysis.ClassifiedRequest;
import com.transitstat.analyzer.dto.report.Weekday;

import lombok.Getter;
import lombok.ToString;

/** Running totals for one calendar day. The weekday is fixed when the bucket is created. */
@Getter
@ToString
public class DayBucket {

  private final String date;
  private final Weekday weekday;
  private long effective;
  private long route;
  private long diagram;
  private long fare;

  public DayBucket(String date, Weekday weekday) {
    this.date = date;
    this.weekday = weekday;
  }

  void add(ClassifiedRequest request) {
    effective += request.getEffective();
    route += request.getRoute();
    diagram += request.getDiagram();
    fare += request.getFare();
  }

  void add(DayBucket other) {
    effective += other.effective;
    route += other.route;
    diagram += other.diagram;
    fare += other.fare;
  }
}
