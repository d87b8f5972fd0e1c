package com.transitstat.analyzer.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.transitstat.analyzer.config.ApplicationProperties;
import com.transitstat.analyzer.dto.analysis.AnalysisRequest;
import com.transitstat.analyzer.dto.analysis.AnalysisResult;
import com.transitstat.analyzer.dto.analysis.AnalysisSummary;
import com.transitstat.analyzer.dto.analysis.CanonicalDay;
import com.transitstat.analyzer.dto.analysis.ClassifiedRequest;
import com.transitstat.analyzer.dto.analysis.LineOutcome;
import com.transitstat.analyzer.dto.analysis.LogLine;
import com.transitstat.analyzer.dto.analysis.ParsedLine;
import com.transitstat.analyzer.dto.profile.CompiledProfile;
import com.transitstat.analyzer.dto.report.AccessReport;
import com.transitstat.analyzer.exception.ConfigurationException;
import com.transitstat.analyzer.exception.InvalidMonthException;
import com.transitstat.analyzer.exception.LogRootNotFoundException;
import com.transitstat.analyzer.exception.UnknownProfileException;
import com.transitstat.analyzer.service.aggregation.DailyAggregator;
import com.transitstat.analyzer.service.classification.RequestClassificationService;
import com.transitstat.analyzer.service.data_processing.LogFileReaderService;
import com.transitstat.analyzer.service.parsing.LogRecordParserService;
import com.transitstat.analyzer.service.parsing.MonthFilterService;
import com.transitstat.analyzer.service.profile.PatternProfileRegistryService;
import com.transitstat.analyzer.service.report.ReportBuilderService;
import com.transitstat.analyzer.service.storage.IRejectedLineSink;
import com.transitstat.analyzer.service.storage.RejectedLineSinkFactory;
import com.transitstat.analyzer.service.storage.ReportOutputService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one monthly analysis: every line of every file under the log root goes through
 * parse, status check, month filter and classification, and accepted records are added to the
 * day totals. The report is written once, after all input is read.
 *
 * <p>Problems with a single line never stop the run. Only configuration errors do, and they are
 * raised before the first line is read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogAnalysisService {

  private static final int OK_STATUS = 200;

  private final ApplicationProperties applicationProperties;
  private final PatternProfileRegistryService profileRegistry;
  private final LogFileReaderService logFileReader;
  private final LogRecordParserService recordParser;
  private final MonthFilterService monthFilter;
  private final RequestClassificationService requestClassifier;
  private final ReportBuilderService reportBuilder;
  private final ReportOutputService reportOutput;
  private final RejectedLineSinkFactory sinkFactory;

  public AnalysisResult analyze(AnalysisRequest request) {
    CompiledProfile profile = validate(request);

    List<Path> files;
    try {
      files = logFileReader.listLogFiles(request.getLogRoot());
    } catch (IOException e) {
      throw new LogRootNotFoundException(request.getLogRoot().toString());
    }
    log.info(
        "Analyzing {} log files under {} for month {} with profile {}",
        files.size(),
        request.getLogRoot(),
        request.getMonth(),
        profile.getKey());

    long startTime = System.currentTimeMillis();
    LineProcessor processor = newProcessor(request, profile);

    for (Path file : files) {
      try {
        long lines = logFileReader.forEachLine(file, processor::process);
        log.debug("Processed {} lines from {}", lines, file);
      } catch (IOException | UncheckedIOException e) {
        log.error("Failed to read log file {}, skipping: {}", file, e.getMessage());
      }
      processor.summary.setFilesScanned(processor.summary.getFilesScanned() + 1);
    }

    return finish(request, processor, startTime);
  }

  /**
   * Runs the analysis over lines supplied by the caller instead of the log root. The request's
   * log root is not consulted.
   */
  public AnalysisResult analyzeLines(AnalysisRequest request, Iterator<LogLine> lines) {
    CompiledProfile profile = resolveProfile(request);
    long startTime = System.currentTimeMillis();
    LineProcessor processor = newProcessor(request, profile);
    while (lines.hasNext()) {
      processor.process(lines.next());
    }
    return finish(request, processor, startTime);
  }

  /**
   * Checks the request before any line is read.
   *
   * @throws ConfigurationException on an invalid month, unsupported server pair or missing log
   *     root
   */
  public CompiledProfile validate(AnalysisRequest request) {
    CompiledProfile profile = resolveProfile(request);
    Path root = request.getLogRoot();
    if (root == null || !Files.exists(root) || !Files.isReadable(root)) {
      throw new LogRootNotFoundException(String.valueOf(root));
    }
    return profile;
  }

  private CompiledProfile resolveProfile(AnalysisRequest request) {
    Integer month = request.getMonth();
    if (month == null || month < 1 || month > 12) {
      throw new InvalidMonthException(month);
    }
    if (!applicationProperties.getAllowedServerNames().contains(request.getServerName())
        || !applicationProperties.getAllowedServerTypes().contains(request.getServerType())) {
      throw new UnknownProfileException(request.getServerName(), request.getServerType());
    }
    return profileRegistry.resolve(request.getServerName(), request.getServerType());
  }

  private LineProcessor newProcessor(AnalysisRequest request, CompiledProfile profile) {
    return new LineProcessor(
        profile,
        request.getMonth(),
        sinkFactory.unusualSink(request),
        sinkFactory.invalidSink(request));
  }

  private AnalysisResult finish(
      AnalysisRequest request, LineProcessor processor, long startTime) {
    AccessReport report = reportBuilder.build(processor.aggregator.buckets());
    Path reportFile = reportOutput.write(report, request);

    AnalysisSummary summary = processor.summary;
    summary.setProcessingTimeMs(System.currentTimeMillis() - startTime);
    log.info(
        "Analysis finished: {} days, {} effective hits ({})",
        processor.aggregator.size(),
        report.getTotalStat(),
        summary);

    return new AnalysisResult(report, summary, reportFile);
  }

  /** Per-run state: one profile, one aggregator, one set of sinks. */
  private final class LineProcessor {

    private final CompiledProfile profile;
    private final int month;
    private final IRejectedLineSink unusualSink;
    private final IRejectedLineSink invalidSink;
    private final DailyAggregator aggregator = new DailyAggregator();
    private final AnalysisSummary summary = new AnalysisSummary();

    private LineProcessor(
        CompiledProfile profile,
        int month,
        IRejectedLineSink unusualSink,
        IRejectedLineSink invalidSink) {
      this.profile = profile;
      this.month = month;
      this.unusualSink = unusualSink;
      this.invalidSink = invalidSink;
    }

    void process(LogLine line) {
      LineOutcome outcome;
      try {
        outcome = evaluate(line);
      } catch (RuntimeException e) {
        log.debug(
            "{}:{} could not be processed: {}",
            line.getFile(),
            line.getLineNumber(),
            e.toString());
        unusualSink.reject(line.getFile(), line.getText());
        outcome = LineOutcome.UNUSUAL;
      }
      summary.record(outcome);
    }

    private LineOutcome evaluate(LogLine line) {
      if (line.isDecodeFailed()) {
        unusualSink.reject(line.getFile(), line.getText());
        return LineOutcome.UNUSUAL;
      }

      Optional<ParsedLine> parsed = recordParser.parse(line.getText(), profile);
      if (parsed.isEmpty()) {
        unusualSink.reject(line.getFile(), line.getText());
        invalidSink.reject(line.getFile(), line.getText());
        return LineOutcome.INVALID;
      }
      ParsedLine fields = parsed.get();

      if (!isOkStatus(fields.getStatus())) {
        return LineOutcome.STATUS_DROPPED;
      }

      Optional<CanonicalDay> day = monthFilter.accept(fields, month);
      if (day.isEmpty()) {
        return LineOutcome.MONTH_DROPPED;
      }

      if (!fields.has(CompiledProfile.REQUEST_FIELD)) {
        unusualSink.reject(line.getFile(), line.getText());
        return LineOutcome.UNUSUAL;
      }

      Optional<ClassifiedRequest> classified =
          requestClassifier.classify(fields.getRequest(), profile);
      if (classified.isEmpty()) {
        return LineOutcome.MALFORMED_REQUEST;
      }
      aggregator.absorb(day.get(), classified.get());
      return LineOutcome.ABSORBED;
    }
  }

  private static boolean isOkStatus(String status) {
    if (status == null) {
      return false;
    }
    try {
      return Integer.parseInt(status.trim()) == OK_STATUS;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
