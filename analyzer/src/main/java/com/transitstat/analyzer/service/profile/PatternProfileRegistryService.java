package com.transitstat.analyzer.service.profile;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitstat.analyzer.config.ApplicationProperties;
import com.transitstat.analyzer.dto.profile.CompiledProfile;
import com.transitstat.analyzer.dto.profile.PatternProfile;
import com.transitstat.analyzer.exception.ConfigurationException;
import com.transitstat.analyzer.exception.UnknownProfileException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lookup table of log profiles keyed by (server name, server type). The table is loaded once from
 * a JSON resource on the classpath so that supporting a new site or platform only means adding a
 * row to that file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternProfileRegistryService {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;

  private final Map<String, CompiledProfile> profiles = new LinkedHashMap<>();

  @PostConstruct
  public void init() {
    loadProfiles(applicationProperties.getProfileResource());
  }

  private void loadProfiles(String resource) {
    InputStream is = PatternProfileRegistryService.class.getResourceAsStream(resource);
    if (is == null) {
      throw new ConfigurationException("Log profile table not found on classpath: " + resource);
    }

    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {

      List<PatternProfile> definitions =
          objectMapper.readValue(reader, new TypeReference<List<PatternProfile>>() {});

      for (PatternProfile definition : definitions) {
        register(definition);
      }

      log.info("Loaded {} log profiles from {}", profiles.size(), resource);

    } catch (IOException e) {
      log.error("Failed to load log profiles from {}", resource, e);
      throw new ConfigurationException("Failed to initialize log profile registry", e);
    }
  }

  /**
   * Compiles and adds one profile, replacing any previous profile for the same pair.
   *
   * @throws ConfigurationException if the definition does not compile
   */
  public void register(PatternProfile definition) {
    CompiledProfile compiled;
    try {
      compiled = CompiledProfile.compile(definition);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
          String.format(
              "Invalid log profile %s/%s: %s",
              definition.getServerName(), definition.getServerType(), e.getMessage()),
          e);
    }

    CompiledProfile previous = profiles.put(compiled.getKey(), compiled);
    if (previous != null) {
      log.warn(
          "Log profile {} defined more than once; using the last definition", compiled.getKey());
    }
    log.debug(
        "Registered log profile {} with fields {}", compiled.getKey(), compiled.getFieldNames());
  }

  /**
   * Resolve the profile for a server/platform pair.
   *
   * @param serverName server identity, e.g. {@code fukuoka}
   * @param serverType platform type, e.g. {@code sp} or {@code pc}
   * @return the compiled profile, never null
   * @throws UnknownProfileException if the pair has no profile
   */
  public CompiledProfile resolve(String serverName, String serverType) {
    CompiledProfile profile = profiles.get(CompiledProfile.keyOf(serverName, serverType));
    if (profile == null) {
      throw new UnknownProfileException(serverName, serverType);
    }
    return profile;
  }

  public boolean isSupported(String serverName, String serverType) {
    return profiles.containsKey(CompiledProfile.keyOf(serverName, serverType));
  }

  public List<String> getSupportedKeys() {
    return new ArrayList<>(profiles.keySet());
  }
}
