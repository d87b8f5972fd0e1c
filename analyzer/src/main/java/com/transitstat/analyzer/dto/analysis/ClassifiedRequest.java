package com.transitstat.analyzer.dto.analysis;

import lombok.Value;

/** Per-request category flags, each 0 or 1. */
@Value
public class ClassifiedRequest {

  public static final ClassifiedRequest NONE = new ClassifiedRequest(0, 0, 0, 0);

  int effective;
  int route;
  int diagram;
  int fare;

  public static ClassifiedRequest of(
      boolean effective, boolean route, boolean diagram, boolean fare) {
    if (!effective && !route && !diagram && !fare) {
      return NONE;
    }
    return new ClassifiedRequest(
        effective ? 1 : 0, route ? 1 : 0, diagram ? 1 : 0, fare ? 1 : 0);
  }
}
