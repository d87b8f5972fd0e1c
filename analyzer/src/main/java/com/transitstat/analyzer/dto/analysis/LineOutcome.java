package com.transitstat.analyzer.dto.analysis;

/** What happened to a single input line. */
public enum LineOutcome {
  ABSORBED,
  /** Did not match the line pattern. */
  INVALID,
  /** Undecodable, or matched without a usable request field. */
  UNUSUAL,
  STATUS_DROPPED,
  MONTH_DROPPED,
  MALFORMED_REQUEST
}
