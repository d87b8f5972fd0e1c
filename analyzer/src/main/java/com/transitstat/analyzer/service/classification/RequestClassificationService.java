package com.transitstat.analyzer.service.classification;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.transitstat.analyzer.config.ApplicationProperties;
import com.transitstat.analyzer.dto.analysis.ClassifiedRequest;
import com.transitstat.analyzer.dto.profile.CompiledProfile;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a request line ({@code METHOD PATH PROTOCOL}) to the categories it counts towards.
 *
 * <p>A path is effective when it is one of the profile's index paths or when any route, diagram or
 * fare trigger is found in it. Triggers are regular expressions searched anywhere in the path, and
 * the three categories are independent, so one path can count as both a route search and a fare
 * search. Each flag is at most 1 per request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestClassificationService {

  private final ApplicationProperties applicationProperties;

  // Access logs repeat the same few paths; classification is pure so results can be reused.
  private Cache<String, ClassifiedRequest> classificationCache;

  @PostConstruct
  public void init() {
    ApplicationProperties.Cache cacheProperties = applicationProperties.getCache();
    if (cacheProperties.isEnabled()) {
      classificationCache =
          CacheBuilder.newBuilder()
              .maximumSize(cacheProperties.getMaxSize())
              .expireAfterWrite(cacheProperties.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
              .build();
    }
  }

  /**
   * Classifies the path of a request field such as {@code GET /fare/fare_index HTTP/1.1}.
   *
   * @return the category flags, or empty when the request field has no path
   */
  public Optional<ClassifiedRequest> classify(String requestField, CompiledProfile profile) {
    String path = extractPath(requestField);
    if (path == null) {
      return malformedRequestLine(requestField);
    }
    return Optional.of(classifyPath(path, profile));
  }

  /**
   * Returns the second whitespace-separated token of the request field, or null if there is none.
   */
  public String extractPath(String requestField) {
    if (requestField == null) {
      return null;
    }
    String[] tokens = requestField.trim().split("\\s+");
    return tokens.length >= 2 ? tokens[1] : null;
  }

  /**
   * Request fields without a path, such as a lone control byte sent to the port, count towards
   * nothing and are dropped without a diagnostics entry.
   */
  private Optional<ClassifiedRequest> malformedRequestLine(String requestField) {
    // TODO: decide with the site operators whether these should go to unusual.txt instead
    log.trace("Request field has no path: {}", requestField);
    return Optional.empty();
  }

  public ClassifiedRequest classifyPath(String path, CompiledProfile profile) {
    if (classificationCache == null) {
      return evaluate(path, profile);
    }
    try {
      return classificationCache.get(profile.getKey() + " " + path, () -> evaluate(path, profile));
    } catch (ExecutionException e) {
      throw new IllegalStateException("Classification failed for path " + path, e.getCause());
    }
  }

  private ClassifiedRequest evaluate(String path, CompiledProfile profile) {
    boolean route = anyFound(profile.getRouteTriggers(), path);
    boolean diagram = anyFound(profile.getDiagramTriggers(), path);
    boolean fare = anyFound(profile.getFareTriggers(), path);
    boolean effective = profile.getIndexPaths().contains(path) || route || diagram || fare;
    return ClassifiedRequest.of(effective, route, diagram, fare);
  }

  private static boolean anyFound(List<Pattern> triggers, String path) {
    for (Pattern trigger : triggers) {
      if (trigger.matcher(path).find()) {
        return true;
      }
    }
    return false;
  }

  public void clearCache() {
    if (classificationCache != null) {
      classificationCache.invalidateAll();
    }
  }
}
