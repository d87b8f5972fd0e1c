package com.transitstat.analyzer.service.parsing;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.transitstat.analyzer.dto.analysis.CanonicalDay;
import com.transitstat.analyzer.dto.analysis.ParsedLine;

/**
 * Keeps records of the target month. The timestamp looks like {@code 10/Feb/2024:08:00:00 +0900};
 * the offset is dropped and the local wall-clock date is used as is.
 */
@Service
public class MonthFilterService {

  private static final DateTimeFormatter ACCESS_LOG_TIMESTAMP =
      new DateTimeFormatterBuilder()
          .parseCaseInsensitive()
          .appendPattern("d/MMM/uuuu:HH:mm:ss")
          .toFormatter(Locale.ENGLISH)
          .withResolverStyle(ResolverStyle.STRICT);

  public Optional<CanonicalDay> accept(ParsedLine parsed, int targetMonth) {
    return parseTimestamp(parsed.getDatetime())
        .filter(timestamp -> timestamp.getMonthValue() == targetMonth)
        .map(timestamp -> CanonicalDay.of(timestamp.toLocalDate()));
  }

  /** Parses the part before the first space, or returns empty if it is not a valid timestamp. */
  public Optional<LocalDateTime> parseTimestamp(String datetime) {
    if (datetime == null || datetime.isBlank()) {
      return Optional.empty();
    }
    String local = datetime.trim().split(" ")[0];
    try {
      return Optional.of(LocalDateTime.parse(local, ACCESS_LOG_TIMESTAMP));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
