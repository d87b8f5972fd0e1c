package com.transitstat.analyzer.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the log profile table: how lines of a given server/platform pair are matched and
 * which request paths count towards each functional category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternProfile {

  @JsonProperty("server_name")
  private String serverName;

  @JsonProperty("server_type")
  private String serverType;

  /** Java regular expression with named groups; datetime, status and request are required. */
  @JsonProperty("line_pattern")
  private String linePattern;

  /** Paths counted as effective on exact match, with no further classification. */
  @JsonProperty("index_paths")
  private List<String> indexPaths;

  @JsonProperty("route_triggers")
  private List<String> routeTriggers;

  @JsonProperty("diagram_triggers")
  private List<String> diagramTriggers;

  @JsonProperty("fare_triggers")
  private List<String> fareTriggers;

  @JsonProperty("description")
  private String description;
}
