package com.transitstat.analyzer.service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.transitstat.analyzer.config.ApplicationProperties;
import com.transitstat.analyzer.dto.analysis.AnalysisRequest;
import com.transitstat.analyzer.exception.LogRootNotFoundException;

import lombok.RequiredArgsConstructor;

/** Turns the bound {@code analyzer.*} properties into a run request, filling in defaults. */
@Component
@RequiredArgsConstructor
public class AnalysisRequestFactory {

  private final ApplicationProperties applicationProperties;
  private final Clock clock;

  public AnalysisRequest fromProperties() {
    LocalDate today = LocalDate.now(clock);
    String logRoot = applicationProperties.getLogRoot();
    if (logRoot == null || logRoot.isBlank()) {
      throw new LogRootNotFoundException("<unset> (set analyzer.log-root)");
    }

    Integer month = applicationProperties.getMonth();
    if (month == null) {
      month = previousMonth(today);
    }

    return AnalysisRequest.builder()
        .logRoot(Paths.get(logRoot))
        .month(month)
        .serverName(applicationProperties.getServerName())
        .serverType(applicationProperties.getServerType())
        .outputDir(outputDir())
        .collectInvalid(applicationProperties.isCollectInvalid())
        .outputNaming(applicationProperties.getOutputNaming())
        .runDate(today)
        .build();
  }

  /** Month before the one containing {@code today}; January rolls back to December. */
  public static int previousMonth(LocalDate today) {
    return today.minusMonths(1).getMonthValue();
  }

  private Path outputDir() {
    String dir = applicationProperties.getOutputDir();
    return Paths.get(dir == null || dir.isBlank() ? "./" : dir);
  }
}
