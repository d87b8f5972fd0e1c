package com.transitstat.analyzer.UnitTests.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.transitstat.analyzer.dto.analysis.ParsedLine;
import com.transitstat.analyzer.dto.profile.CompiledProfile;
import com.transitstat.analyzer.fixtures.TestFixtures;
import com.transitstat.analyzer.service.parsing.LogRecordParserService;
import com.transitstat.analyzer.service.profile.PatternProfileRegistryService;

@DisplayName("Log Record Parser Unit Tests")
class LogRecordParserServiceTest {

  private LogRecordParserService parser;
  private CompiledProfile spProfile;
  private CompiledProfile pcProfile;

  @BeforeEach
  void setUp() {
    parser = new LogRecordParserService();
    PatternProfileRegistryService registry = TestFixtures.loadedRegistry();
    spProfile = registry.resolve("fukuoka", "sp");
    pcProfile = registry.resolve("fukuoka", "pc");
  }

  @Test
  @DisplayName("Should capture all sp fields")
  void shouldParseSpLine() {
    Optional<ParsedLine> result = parser.parse(TestFixtures.SP_INDEX_LINE, spProfile);

    assertThat(result).isPresent();
    ParsedLine line = result.get();
    assertThat(line.get("remoteAddr")).isEqualTo("203.0.113.5");
    assertThat(line.getDatetime()).isEqualTo("10/Feb/2024:08:00:00 +0900");
    assertThat(line.getRequest()).isEqualTo("GET / HTTP/1.1");
    assertThat(line.getStatus()).isEqualTo("200");
    assertThat(line.get("size")).isEqualTo("512");
    assertThat(line.get("userAgent")).isEqualTo("UA");
  }

  @Test
  @DisplayName("Should capture response time on pc lines")
  void shouldParsePcLine() {
    Optional<ParsedLine> result = parser.parse(TestFixtures.PC_ROUTE_FARE_LINE, pcProfile);

    assertThat(result).isPresent();
    assertThat(result.get().get("responseTime")).isEqualTo("15320");
    assertThat(result.get().get("identity")).isEqualTo("-");
    assertThat(result.get().getRequest()).isEqualTo("GET /route/nsresult?fare=1 HTTP/1.1");
  }

  @Test
  @DisplayName("Should accept a dash as size on pc lines")
  void shouldAcceptDashSize() {
    Optional<ParsedLine> result = parser.parse(TestFixtures.PC_DIAGRAM_LINE, pcProfile);

    assertThat(result).isPresent();
    assertThat(result.get().get("size")).isEqualTo("-");
  }

  @Test
  @DisplayName("Should search rather than require a full-line match")
  void shouldFindPatternInsideLongerLine() {
    Optional<ParsedLine> result =
        parser.parse("garbage prefix " + TestFixtures.SP_INDEX_LINE + "\r", spProfile);

    assertThat(result).isPresent();
    assertThat(result.get().getStatus()).isEqualTo("200");
  }

  @Test
  @DisplayName("Should report no match for truncated lines")
  void shouldNotMatchTruncatedLine() {
    assertThat(parser.parse(TestFixtures.SP_TRUNCATED_LINE, spProfile)).isEmpty();
  }

  @Test
  @DisplayName("Should not match sp lines with the pc pattern")
  void shouldNotMatchOtherPlatformFormat() {
    assertThat(parser.parse(TestFixtures.SP_INDEX_LINE, pcProfile)).isEmpty();
  }

  @Test
  @DisplayName("Should handle empty and null lines")
  void shouldHandleEmptyInput() {
    assertThat(parser.parse("", spProfile)).isEmpty();
    assertThat(parser.parse(null, spProfile)).isEmpty();
  }

  @Test
  @DisplayName("Should keep a control-byte request as the request field")
  void shouldParseControlByteRequest() {
    Optional<ParsedLine> result = parser.parse(TestFixtures.SP_CONTROL_BYTE_LINE, spProfile);

    assertThat(result).isPresent();
    assertThat(result.get().getRequest()).isEqualTo("\u0003");
  }

  @Test
  @DisplayName("Should treat a regex engine fault as no match")
  void shouldSurviveRegexEngineFault() {
    CompiledProfile backtracking = CompiledProfile.compile(TestFixtures.backtrackingProfile());

    assertThat(parser.parse(TestFixtures.LONG_ALTERNATION_LINE, backtracking)).isEmpty();
  }
}
