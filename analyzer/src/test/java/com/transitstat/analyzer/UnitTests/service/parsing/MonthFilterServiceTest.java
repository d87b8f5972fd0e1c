package com.transitstat.analyzer.UnitTests.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.transitstat.analyzer.dto.analysis.CanonicalDay;
import com.transitstat.analyzer.dto.analysis.ParsedLine;
import com.transitstat.analyzer.dto.report.Weekday;
import com.transitstat.analyzer.service.parsing.MonthFilterService;

class MonthFilterServiceTest {

  private MonthFilterService monthFilter;

  @BeforeEach
  void setUp() {
    monthFilter = new MonthFilterService();
  }

  @Test
  void shouldAcceptRecordOfTargetMonth() {
    Optional<CanonicalDay> day = monthFilter.accept(line("10/Feb/2024:08:00:00 +0900"), 2);

    assertThat(day).isPresent();
    assertThat(day.get().getKey()).isEqualTo("2024/02/10");
    assertThat(day.get().getDate()).isEqualTo(LocalDate.of(2024, 2, 10));
    assertThat(day.get().getWeekday()).isEqualTo(Weekday.SATURDAY);
  }

  @Test
  void shouldRejectRecordOfOtherMonth() {
    assertThat(monthFilter.accept(line("31/Jan/2024:23:59:59 +0900"), 2)).isEmpty();
  }

  @Test
  void shouldUseLocalDateAndIgnoreOffset() {
    // 23:30 at -0500 is already March in UTC, but the local date is what counts
    Optional<CanonicalDay> day = monthFilter.accept(line("29/Feb/2024:23:30:00 -0500"), 2);

    assertThat(day).isPresent();
    assertThat(day.get().getKey()).isEqualTo("2024/02/29");
    assertThat(day.get().getWeekday()).isEqualTo(Weekday.THURSDAY);
  }

  @Test
  void shouldAcceptAnyYear() {
    assertThat(monthFilter.accept(line("01/Feb/2019:00:00:00 +0000"), 2)).isPresent();
  }

  @Test
  void shouldParseSingleDigitDayAndLowerCaseMonth() {
    Optional<CanonicalDay> day = monthFilter.accept(line("5/feb/2024:12:00:00 +0900"), 2);

    assertThat(day).isPresent();
    assertThat(day.get().getKey()).isEqualTo("2024/02/05");
  }

  @Test
  void shouldAcceptTimestampWithoutOffset() {
    assertThat(monthFilter.accept(line("10/Feb/2024:08:00:00"), 2)).isPresent();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "   ",
        "2024-02-10T08:00:00",
        "10/Foo/2024:08:00:00 +0900",
        "31/Feb/2024:08:00:00 +0900",
        "10/Feb/2024:25:00:00 +0900",
        "10/Feb/2024 08:00:00"
      })
  void shouldRejectUnparseableTimestamps(String datetime) {
    assertThat(monthFilter.accept(line(datetime), 2)).isEmpty();
  }

  @Test
  void shouldRejectMissingDatetimeField() {
    assertThat(monthFilter.accept(new ParsedLine(Map.of("status", "200")), 2)).isEmpty();
  }

  private static ParsedLine line(String datetime) {
    return new ParsedLine(Map.of("datetime", datetime, "status", "200", "request", "GET / HTTP/1.1"));
  }
}
