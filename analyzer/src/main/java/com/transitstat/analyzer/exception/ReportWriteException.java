package com.transitstat.analyzer.exception;

public class ReportWriteException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ReportWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
