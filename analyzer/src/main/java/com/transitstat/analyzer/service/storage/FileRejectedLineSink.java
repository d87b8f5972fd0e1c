package com.transitstat.analyzer.service.storage;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each rejected line as two lines of text: the absolute path of its file (with forward
 * slashes) followed by the raw line. The file is opened in append mode for every entry, so entries
 * already written survive a crash.
 */
@Slf4j
public class FileRejectedLineSink implements IRejectedLineSink {

  @Getter private final Path target;

  public FileRejectedLineSink(Path target) {
    this.target = target;
  }

  @Override
  public void reject(Path file, String rawLine) {
    String entry = formatPath(file) + "\n" + stripLineEnd(rawLine) + "\n";
    try {
      Path parent = target.getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
      try (Writer writer =
          Files.newBufferedWriter(
              target,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.APPEND)) {
        writer.write(entry);
      }
    } catch (IOException e) {
      log.warn("Failed to record rejected line from {} in {}: {}", file, target, e.getMessage());
    }
  }

  static String formatPath(Path file) {
    return file.toAbsolutePath().normalize().toString().replace('\\', '/');
  }

  private static String stripLineEnd(String rawLine) {
    if (rawLine == null) {
      return "";
    }
    return rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
  }
}
