package com.example.leadengine.service;

import java.util.List;
import java.util.UUID;

/** added は新規登録時のみ true。既存エントリでも停止処理は毎回行う。 */
public record SuppressionResult(
    String address, String domain, boolean added, List<UUID> deadLeadIds, int pausedMessages) {

  public SuppressionResult {
    deadLeadIds = List.copyOf(deadLeadIds);
  }
}
