package com.transitstat.analyzer.UnitTests.service.classification;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.transitstat.analyzer.config.ApplicationProperties;
import com.transitstat.analyzer.dto.analysis.ClassifiedRequest;
import com.transitstat.analyzer.dto.profile.CompiledProfile;
import com.transitstat.analyzer.fixtures.TestFixtures;
import com.transitstat.analyzer.service.classification.RequestClassificationService;
import com.transitstat.analyzer.service.profile.PatternProfileRegistryService;

@DisplayName("Request Classification Unit Tests")
class RequestClassificationServiceTest {

  private RequestClassificationService classifier;
  private CompiledProfile spProfile;
  private CompiledProfile pcProfile;

  @BeforeEach
  void setUp() {
    classifier = TestFixtures.classifier(TestFixtures.defaultProperties());
    PatternProfileRegistryService registry = TestFixtures.loadedRegistry();
    spProfile = registry.resolve("fukuoka", "sp");
    pcProfile = registry.resolve("fukuoka", "pc");
  }

  private ClassifiedRequest classified(String request, CompiledProfile profile) {
    return classifier.classify(request, profile).orElseThrow();
  }

  @Nested
  @DisplayName("Path extraction")
  class PathExtraction {

    @Test
    void shouldTakeSecondToken() {
      assertThat(classifier.extractPath("GET /fare/fare_index?a=1 HTTP/1.1"))
          .isEqualTo("/fare/fare_index?a=1");
    }

    @Test
    void shouldToleratePathWithoutProtocol() {
      assertThat(classifier.extractPath("GET /")).isEqualTo("/");
    }

    @Test
    void shouldReturnNullWithoutSecondToken() {
      assertThat(classifier.extractPath("\u0003")).isNull();
      assertThat(classifier.extractPath("")).isNull();
      assertThat(classifier.extractPath(null)).isNull();
      assertThat(classifier.extractPath("GET")).isNull();
    }
  }

  @Test
  @DisplayName("Index path is effective and nothing else")
  void shouldCountIndexPathAsEffective() {
    ClassifiedRequest result = classified("GET / HTTP/1.1", spProfile);

    assertThat(result).isEqualTo(new ClassifiedRequest(1, 0, 0, 0));
  }

  @Test
  @DisplayName("Index paths need an exact match")
  void shouldNotTreatIndexPathAsPrefix() {
    ClassifiedRequest result = classified("GET /?utm=mail HTTP/1.1", spProfile);

    assertThat(result).isEqualTo(ClassifiedRequest.NONE);
  }

  @Test
  @DisplayName("Route trigger sets route and effective")
  void shouldClassifyRouteSearch() {
    ClassifiedRequest result =
        classified("GET /schedule/m_search?from=1&to=2 HTTP/1.1", spProfile);

    assertThat(result.getRoute()).isEqualTo(1);
    assertThat(result.getEffective()).isEqualTo(1);
    assertThat(result.getDiagram()).isZero();
    assertThat(result.getFare()).isZero();
  }

  @Test
  @DisplayName("Diagram trigger sets diagram and effective")
  void shouldClassifyDiagram() {
    ClassifiedRequest result =
        classified("GET /schedule/m_eki_diagram_n?st=3 HTTP/1.1", spProfile);

    assertThat(result).isEqualTo(new ClassifiedRequest(1, 0, 1, 0));
  }

  @Test
  @DisplayName("Fare trigger sets fare and effective")
  void shouldClassifyFare() {
    ClassifiedRequest result = classified("POST /fare/fare_index HTTP/1.0", spProfile);

    assertThat(result).isEqualTo(new ClassifiedRequest(1, 0, 0, 1));
  }

  @Test
  @DisplayName("Several route triggers matching still count once")
  void shouldNotIncrementPerMatchingTrigger() {
    ClassifiedRequest result =
        classified("GET /schedule/m_search_detail HTTP/1.1", spProfile);

    assertThat(result.getRoute()).isEqualTo(1);
    assertThat(result.getEffective()).isEqualTo(1);
  }

  @Test
  @DisplayName("A path can be route and fare at once")
  void shouldAllowMultipleCategories() {
    ClassifiedRequest result = classified("GET /route/nsresult?fare=1 HTTP/1.1", pcProfile);

    assertThat(result).isEqualTo(new ClassifiedRequest(1, 1, 0, 1));
  }

  @Test
  @DisplayName("Unrelated paths are not effective")
  void shouldIgnoreUnrelatedPaths() {
    assertThat(classified("GET /images/logo.gif HTTP/1.1", spProfile))
        .isEqualTo(ClassifiedRequest.NONE);
  }

  @Test
  @DisplayName("Request line without a path is not classified")
  void shouldNotClassifyRequestWithoutPath() {
    assertThat(classifier.classify("\u0003", spProfile)).isEmpty();
    assertThat(classifier.classify("GET", spProfile)).isEmpty();
  }

  @Test
  @DisplayName("Triggers are regular expressions")
  void shouldSupportRegexTriggers() {
    CompiledProfile profile =
        CompiledProfile.compile(
            TestFixtures.simpleProfile(
                Collections.singletonList("^/api/v\\d+/route"),
                Collections.emptyList(),
                Collections.emptyList()));

    assertThat(classified("GET /api/v2/route HTTP/1.1", profile).getRoute()).isEqualTo(1);
    assertThat(classified("GET /x/api/v2/route HTTP/1.1", profile).getRoute()).isZero();
  }

  @Test
  @DisplayName("Classification is repeatable with and without the cache")
  void shouldBeDeterministic() {
    ApplicationProperties noCache = new ApplicationProperties();
    noCache.getCache().setEnabled(false);
    RequestClassificationService uncached = TestFixtures.classifier(noCache);

    for (String request :
        Arrays.asList(
            "GET / HTTP/1.1",
            "GET /route/nsresult?fare=1 HTTP/1.1",
            "GET /diagram HTTP/1.1",
            "GET /nothing HTTP/1.1")) {
      ClassifiedRequest first = classified(request, pcProfile);
      ClassifiedRequest second = classified(request, pcProfile);
      assertThat(second).isEqualTo(first);
      assertThat(uncached.classify(request, pcProfile).orElseThrow()).isEqualTo(first);
    }
  }

  @Test
  @DisplayName("Cached results are kept apart per profile")
  void shouldNotShareCacheAcrossProfiles() {
    // "/mobilet" is a route trigger for sp but means nothing on pc
    assertThat(classified("GET /mobilet HTTP/1.1", spProfile).getRoute()).isEqualTo(1);
    assertThat(classified("GET /mobilet HTTP/1.1", pcProfile).getRoute()).isZero();

    classifier.clearCache();
    assertThat(classified("GET /mobilet HTTP/1.1", spProfile).getRoute()).isEqualTo(1);
  }
}
