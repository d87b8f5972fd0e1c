package com.transitstat.analyzer.dto.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Getter;

/**
 * A {@link PatternProfile} with its line pattern and triggers compiled. Instances are immutable
 * and shared for the whole run.
 */
@Getter
public final class CompiledProfile {

  public static final String DATETIME_FIELD = "datetime";
  public static final String STATUS_FIELD = "status";
  public static final String REQUEST_FIELD = "request";

  private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

  private final String serverName;
  private final String serverType;
  private final Pattern linePattern;
  private final List<String> fieldNames;
  private final Set<String> indexPaths;
  private final List<Pattern> routeTriggers;
  private final List<Pattern> diagramTriggers;
  private final List<Pattern> fareTriggers;

  private CompiledProfile(PatternProfile definition) {
    this.serverName = definition.getServerName();
    this.serverType = definition.getServerType();
    this.linePattern = Pattern.compile(definition.getLinePattern());
    this.fieldNames = Collections.unmodifiableList(extractFieldNames(definition.getLinePattern()));
    this.indexPaths =
        Collections.unmodifiableSet(new LinkedHashSet<>(nullToEmpty(definition.getIndexPaths())));
    this.routeTriggers = compileAll(definition.getRouteTriggers());
    this.diagramTriggers = compileAll(definition.getDiagramTriggers());
    this.fareTriggers = compileAll(definition.getFareTriggers());
  }

  /**
   * Compiles the given definition.
   *
   * @throws java.util.regex.PatternSyntaxException if the line pattern or a trigger is not a valid
   *     regular expression
   * @throws IllegalArgumentException if a required field group is missing from the line pattern
   */
  public static CompiledProfile compile(PatternProfile definition) {
    if (definition.getServerName() == null || definition.getServerType() == null) {
      throw new IllegalArgumentException("Profile must declare server_name and server_type");
    }
    if (definition.getLinePattern() == null || definition.getLinePattern().isBlank()) {
      throw new IllegalArgumentException("Profile must declare a line_pattern");
    }
    CompiledProfile compiled = new CompiledProfile(definition);
    for (String required : List.of(DATETIME_FIELD, STATUS_FIELD, REQUEST_FIELD)) {
      if (!compiled.fieldNames.contains(required)) {
        throw new IllegalArgumentException(
            String.format(
                "Line pattern of %s is missing the '%s' group", compiled.getKey(), required));
      }
    }
    return compiled;
  }

  public static String keyOf(String serverName, String serverType) {
    return serverName + "/" + serverType;
  }

  public String getKey() {
    return keyOf(serverName, serverType);
  }

  public Matcher matcher(String line) {
    return linePattern.matcher(line);
  }

  private static List<String> extractFieldNames(String regex) {
    List<String> names = new ArrayList<>();
    Matcher m = NAMED_GROUP.matcher(regex);
    while (m.find()) {
      names.add(m.group(1));
    }
    return names;
  }

  private static List<Pattern> compileAll(List<String> triggers) {
    List<Pattern> compiled = new ArrayList<>();
    for (String trigger : nullToEmpty(triggers)) {
      compiled.add(Pattern.compile(trigger));
    }
    return Collections.unmodifiableList(compiled);
  }

  private static List<String> nullToEmpty(List<String> values) {
    return values != null ? values : Collections.emptyList();
  }

  @Override
  public String toString() {
    return "CompiledProfile[" + getKey() + "]";
  }
}
