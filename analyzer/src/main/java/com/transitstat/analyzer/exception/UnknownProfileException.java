package com.transitstat.analyzer.exception;

import lombok.Getter;

@Getter
public class UnknownProfileException extends ConfigurationException {

  private static final long serialVersionUID = 1L;

  private final String serverName;
  private final String serverType;

  public UnknownProfileException(String serverName, String serverType) {
    super(String.format("Unknown log profile: server=%s, type=%s", serverName, serverType));
    this.serverName = serverName;
    this.serverType = serverType;
  }
}
