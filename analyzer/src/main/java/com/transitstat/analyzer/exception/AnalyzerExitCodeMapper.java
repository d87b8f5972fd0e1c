package com.transitstat.analyzer.exception;

import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Translates a failed run into the process exit status. Configuration errors exit with 2, any
 * other failure with 1.
 */
@Slf4j
@Component
public class AnalyzerExitCodeMapper implements ExitCodeExceptionMapper {

  public static final int CONFIGURATION_ERROR = 2;
  public static final int RUN_FAILURE = 1;

  @Override
  public int getExitCode(Throwable exception) {
    ConfigurationException configError = findCause(exception, ConfigurationException.class);
    if (configError != null) {
      log.error("Configuration error: {}", configError.getMessage());
      return CONFIGURATION_ERROR;
    }

    ReportWriteException writeError = findCause(exception, ReportWriteException.class);
    if (writeError != null) {
      log.error("Report could not be written: {}", writeError.getMessage());
    } else {
      log.error("Unexpected error during analysis", exception);
    }
    return RUN_FAILURE;
  }

  private static <T extends Throwable> T findCause(Throwable exception, Class<T> type) {
    Throwable current = exception;
    while (current != null) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }
}
