package com.transitstat.analyzer.exception;

public class LogRootNotFoundException extends ConfigurationException {

  private static final long serialVersionUID = 1L;

  public LogRootNotFoundException(String logRoot) {
    super(String.format("Log directory not found or unreadable: %s", logRoot));
  }
}
