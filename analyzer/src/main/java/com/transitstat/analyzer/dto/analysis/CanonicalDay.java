package com.transitstat.analyzer.dto.analysis;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

import com.transitstat.analyzer.dto.report.Weekday;

import lombok.Value;

/** The calendar day an accepted record belongs to, with its aggregation key. */
@Value
public class CanonicalDay {

  public static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("uuuu/MM/dd");

  LocalDate date;
  String key;
  Weekday weekday;

  public static CanonicalDay of(LocalDate date) {
    return new CanonicalDay(date, date.format(KEY_FORMAT), Weekday.of(date.getDayOfWeek()));
  }
}
