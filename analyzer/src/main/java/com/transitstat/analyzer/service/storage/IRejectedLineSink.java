package com.transitstat.analyzer.service.storage;

import java.nio.file.Path;

/** Append-only destination for log lines the analysis could not use. */
public interface IRejectedLineSink {

  /**
   * Records one rejected line.
   *
   * @param file the log file the line came from
   * @param rawLine the line as read
   */
  void reject(Path file, String rawLine);

  /** A sink that drops everything. */
  static IRejectedLineSink discarding() {
    return (file, rawLine) -> {};
  }
}
