package com.transitstat.analyzer.exception;

/**
 * Fatal configuration problem detected before any log line is processed. Aborts the whole run.
 */
public class ConfigurationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
