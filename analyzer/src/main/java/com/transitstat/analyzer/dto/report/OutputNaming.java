package com.transitstat.analyzer.dto.report;

/** Suffix used in the report file name {@code <server>-<type>-<suffix>.json}. */
public enum OutputNaming {
  /** Target month number, e.g. {@code fukuoka-sp-2.json}. */
  MONTH,
  /** Run date as yyyyMMdd, e.g. {@code fukuoka-sp-20240301.json}. */
  RUN_DATE
}
