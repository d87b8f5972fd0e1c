package com.transitstat.analyzer.dto.report;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.Value;

/** Monthly statistics written once at the end of a run. */
@Value
@Builder
@JsonPropertyOrder({
  "total_stat",
  "route_stat",
  "diagram_stat",
  "fare_stat",
  "weekday_stat",
  "daily_stat"
})
public class AccessReport {

  @JsonProperty("total_stat")
  long totalStat;

  @JsonProperty("route_stat")
  long routeStat;

  @JsonProperty("diagram_stat")
  long diagramStat;

  @JsonProperty("fare_stat")
  long fareStat;

  /** Effective hits per weekday name; always holds all seven names. */
  @JsonProperty("weekday_stat")
  Map<String, Long> weekdayStat;

  /** Effective hits per yyyy/MM/dd day, ascending. */
  @JsonProperty("daily_stat")
  Map<String, Long> dailyStat;
}
