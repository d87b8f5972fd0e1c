package com.transitstat.analyzer.service.data_processing;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;

import com.transitstat.analyzer.dto.analysis.LogLine;

import lombok.extern.slf4j.Slf4j;

/**
 * Finds log files under a directory and feeds their lines, one at a time, to a consumer. Lines are
 * split on {@code \n} and decoded as UTF-8 individually so one bad line does not spoil the rest
 * of the file.
 */
@Slf4j
@Service
public class LogFileReaderService {

  private static final int NEWLINE = '\n';

  public List<Path> listLogFiles(Path root) throws IOException {
    if (Files.isRegularFile(root)) {
      return List.of(root);
    }
    try (Stream<Path> paths = Files.walk(root)) {
      return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    }
  }

  /**
   * Reads one file.
   *
   * @return the number of lines delivered
   */
  public long forEachLine(Path file, Consumer<LogLine> consumer) throws IOException {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    long lineNumber = 0;
    try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
      ByteArrayOutputStream buffer = new ByteArrayOutputStream(512);
      int b;
      while ((b = in.read()) != -1) {
        if (b == NEWLINE) {
          consumer.accept(decode(file, ++lineNumber, buffer.toByteArray(), decoder));
          buffer.reset();
        } else {
          buffer.write(b);
        }
      }
      if (buffer.size() > 0) {
        consumer.accept(decode(file, ++lineNumber, buffer.toByteArray(), decoder));
      }
    }
    return lineNumber;
  }

  private LogLine decode(Path file, long lineNumber, byte[] bytes, CharsetDecoder decoder) {
    try {
      decoder.reset();
      String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
      return new LogLine(file, lineNumber, text, false);
    } catch (CharacterCodingException e) {
      log.debug("{}:{} is not valid UTF-8", file, lineNumber);
      return new LogLine(file, lineNumber, new String(bytes, StandardCharsets.UTF_8), true);
    }
  }
}
