package com.transitstat.analyzer.dto.analysis;

import java.nio.file.Path;

import com.transitstat.analyzer.dto.report.AccessReport;

import lombok.Value;

@Value
public class AnalysisResult {
  AccessReport report;
  AnalysisSummary summary;
  Path reportFile;
}
