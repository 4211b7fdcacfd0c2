/*
 * どこで: 共通ユーティリティ
 * 何を: 監査ログとログ MDC で共有する相関 ID を採番する
 * なぜ: 1 リード分の処理をまたいで因果を追跡できるようにするため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private static final String CORRELATION_PREFIX = "req-";
  private static final int CORRELATION_HEX_LENGTH = 12;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 監査用の短い相関 ID。例: {@code req-3f9a0c12b7de} */
  public static String newCorrelationId() {
    final String hex = UUID.randomUUID().toString().replace("-", "");
    return CORRELATION_PREFIX + hex.substring(0, CORRELATION_HEX_LENGTH);
  }

  public static String orNew(String correlationId) {
    if (correlationId == null || correlationId.isBlank()) {
      return newCorrelationId();
    }
    return correlationId;
  }
}
