package com.transitstat.analyzer.dto.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.transitstat.analyzer.dto.profile.CompiledProfile;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Named fields captured from one log line. Groups that did not participate are absent. */
@ToString
@EqualsAndHashCode
public final class ParsedLine {

  private final Map<String, String> fields;

  public ParsedLine(Map<String, String> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public String get(String field) {
    return fields.get(field);
  }

  public boolean has(String field) {
    String value = fields.get(field);
    return value != null && !value.isBlank();
  }

  public String getStatus() {
    return fields.get(CompiledProfile.STATUS_FIELD);
  }

  public String getDatetime() {
    return fields.get(CompiledProfile.DATETIME_FIELD);
  }

  public String getRequest() {
    return fields.get(CompiledProfile.REQUEST_FIELD);
  }
}
