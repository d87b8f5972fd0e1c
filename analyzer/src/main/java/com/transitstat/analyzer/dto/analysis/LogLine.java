package com.transitstat.analyzer.dto.analysis;

import java.nio.file.Path;

import lombok.Value;

/** One raw line together with the file it came from. */
@Value
public class LogLine {

  Path file;
  long lineNumber;
  String text;

  /** True when the bytes were not valid UTF-8; {@link #text} then holds a lenient decoding. */
  boolean decodeFailed;

  public static LogLine of(Path file, long lineNumber, String text) {
    return new LogLine(file, lineNumber, text, false);
  }
}
