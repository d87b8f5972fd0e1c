package com.transitstat.analyzer.service.parsing;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

import org.springframework.stereotype.Service;

import com.transitstat.analyzer.dto.analysis.ParsedLine;
import com.transitstat.analyzer.dto.profile.CompiledProfile;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class LogRecordParserService {

  /**
   * Searches the line with the profile's line pattern.
   *
   * @return the captured fields, or empty when the pattern does not match. A fault inside the
   *     regex engine is treated as no match.
   */
  public Optional<ParsedLine> parse(String rawLine, CompiledProfile profile) {
    if (rawLine == null) {
      return Optional.empty();
    }

    try {
      Matcher matcher = profile.matcher(rawLine);
      if (!matcher.find()) {
        return Optional.empty();
      }

      Map<String, String> fields = new LinkedHashMap<>();
      for (String name : profile.getFieldNames()) {
        String value = matcher.group(name);
        if (value != null) {
          fields.put(name, value);
        }
      }
      return Optional.of(new ParsedLine(fields));

    } catch (RuntimeException | StackOverflowError e) {
      log.debug("Line pattern {} failed on input: {}", profile.getKey(), e.toString());
      return Optional.empty();
    }
  }
}
