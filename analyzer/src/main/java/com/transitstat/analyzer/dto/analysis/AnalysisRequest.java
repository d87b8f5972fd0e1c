package com.transitstat.analyzer.dto.analysis;

import java.nio.file.Path;
import java.time.LocalDate;

import com.transitstat.analyzer.dto.report.OutputNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Fully resolved parameters of one analysis run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

  private Path logRoot;
  private Integer month;
  private String serverName;
  private String serverType;
  private Path outputDir;
  private boolean collectInvalid;

  @Builder.Default private OutputNaming outputNaming = OutputNaming.MONTH;

  /** Date the run happened, used for {@link OutputNaming#RUN_DATE} report names. */
  private LocalDate runDate;
}
