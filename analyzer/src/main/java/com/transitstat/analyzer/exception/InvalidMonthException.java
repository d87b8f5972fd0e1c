package com.transitstat.analyzer.exception;

public class InvalidMonthException extends ConfigurationException {

  private static final long serialVersionUID = 1L;

  public InvalidMonthException(Integer month) {
    super(String.format("Invalid target month: %s (expected 1..12)", month));
  }
}
