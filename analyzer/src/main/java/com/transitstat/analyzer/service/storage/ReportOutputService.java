package com.transitstat.analyzer.service.storage;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitstat.analyzer.dto.analysis.AnalysisRequest;
import com.transitstat.analyzer.dto.report.AccessReport;
import com.transitstat.analyzer.exception.ReportWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReportOutputService {

  private static final DateTimeFormatter RUN_DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

  private final ObjectMapper objectMapper;

  /** Report file name, e.g. {@code fukuoka-sp-2.json}. */
  public String reportFileName(AnalysisRequest request) {
    String suffix;
    switch (request.getOutputNaming()) {
      case RUN_DATE:
        suffix = request.getRunDate().format(RUN_DATE_FORMAT);
        break;
      case MONTH:
      default:
        suffix = String.valueOf(request.getMonth());
        break;
    }
    return String.format("%s-%s-%s.json", request.getServerName(), request.getServerType(), suffix);
  }

  /**
   * Writes the report as UTF-8 JSON, replacing a previous report of the same name.
   *
   * @return the written file
   * @throws ReportWriteException if the file cannot be written
   */
  public Path write(AccessReport report, AnalysisRequest request) {
    Path target = request.getOutputDir().resolve(reportFileName(request));
    try {
      Files.createDirectories(request.getOutputDir());
      Files.deleteIfExists(target);
      try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
        objectMapper.writeValue(writer, report);
      }
      log.info("Wrote report to {}", target);
      return target;
    } catch (IOException e) {
      throw new ReportWriteException("Failed to write report " + target, e);
    }
  }
}
