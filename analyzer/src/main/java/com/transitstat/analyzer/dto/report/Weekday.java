package com.transitstat.analyzer.dto.report;

import java.time.DayOfWeek;

/** Weekday names as they appear in reports, Sunday first. */
public enum Weekday {
  SUNDAY(DayOfWeek.SUNDAY, "日曜日"),
  MONDAY(DayOfWeek.MONDAY, "月曜日"),
  TUESDAY(DayOfWeek.TUESDAY, "火曜日"),
  WEDNESDAY(DayOfWeek.WEDNESDAY, "水曜日"),
  THURSDAY(DayOfWeek.THURSDAY, "木曜日"),
  FRIDAY(DayOfWeek.FRIDAY, "金曜日"),
  SATURDAY(DayOfWeek.SATURDAY, "土曜日");

  private final DayOfWeek dayOfWeek;
  private final String displayName;

  Weekday(DayOfWeek dayOfWeek, String displayName) {
    this.dayOfWeek = dayOfWeek;
    this.displayName = displayName;
  }

  public DayOfWeek getDayOfWeek() {
    return dayOfWeek;
  }

  public String getDisplayName() {
    return displayName;
  }

  public static Weekday of(DayOfWeek dayOfWeek) {
    for (Weekday weekday : values()) {
      if (weekday.dayOfWeek == dayOfWeek) {
        return weekday;
      }
    }
    throw new IllegalArgumentException("Unknown day of week: " + dayOfWeek);
  }
}
