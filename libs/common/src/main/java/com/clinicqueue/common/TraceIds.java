package com.clinicqueue.common;

import java.util.UUID;

public final class TraceIds {
  private static final int MAX_INBOUND_LENGTH = 128;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Keeps a caller-supplied request id when it is usable, otherwise issues a fresh one. */
  public static String reuseOrNew(String inbound) {
    if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
      return newTraceId();
    }
    return inbound.trim();
  }
}
