package com.transitstat.analyzer.service.storage;

import java.nio.file.Path;

import org.springframework.stereotype.Component;

import com.transitstat.analyzer.config.ApplicationProperties;
import com.transitstat.analyzer.dto.analysis.AnalysisRequest;

import lombok.RequiredArgsConstructor;

/** Creates the per-run sinks for unusual and invalid lines under the output directory. */
@Component
@RequiredArgsConstructor
public class RejectedLineSinkFactory {

  private final ApplicationProperties applicationProperties;

  public IRejectedLineSink unusualSink(AnalysisRequest request) {
    return new FileRejectedLineSink(
        resolve(request, applicationProperties.getDiagnostics().getUnusualFileName()));
  }

  /** Only writes when the request asks for invalid lines to be collected. */
  public IRejectedLineSink invalidSink(AnalysisRequest request) {
    if (!request.isCollectInvalid()) {
      return IRejectedLineSink.discarding();
    }
    return new FileRejectedLineSink(
        resolve(request, applicationProperties.getDiagnostics().getInvalidFileName()));
  }

  private Path resolve(AnalysisRequest request, String fileName) {
    return request.getOutputDir().resolve(fileName);
  }
}
