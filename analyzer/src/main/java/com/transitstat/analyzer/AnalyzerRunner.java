package com.transitstat.analyzer;

import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.transitstat.analyzer.dto.analysis.AnalysisRequest;
import com.transitstat.analyzer.dto.analysis.AnalysisResult;
import com.transitstat.analyzer.service.AnalysisRequestFactory;
import com.transitstat.analyzer.service.LogAnalysisService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a single analysis when the application starts. Parameters come from the {@code analyzer.*}
 * properties, e.g. {@code --analyzer.log-root=./logs/fukuoka_1902 --analyzer.month=2}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    value = "analyzer.run-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class AnalyzerRunner implements ApplicationRunner {

  static final String RUN_ID_MDC_KEY = "runId";

  private final AnalysisRequestFactory requestFactory;
  private final LogAnalysisService analysisService;

  @Override
  public void run(ApplicationArguments args) {
    MDC.put(RUN_ID_MDC_KEY, UUID.randomUUID().toString().substring(0, 8));
    try {
      AnalysisRequest request = requestFactory.fromProperties();
      log.info(
          "Starting analysis: server={}, type={}, month={}, logRoot={}, outputDir={},"
              + " collectInvalid={}",
          request.getServerName(),
          request.getServerType(),
          request.getMonth(),
          request.getLogRoot(),
          request.getOutputDir(),
          request.isCollectInvalid());

      AnalysisResult result = analysisService.analyze(request);
      log.info("Report available at {}", result.getReportFile().toAbsolutePath());
    } finally {
      MDC.remove(RUN_ID_MDC_KEY);
    }
  }
}
