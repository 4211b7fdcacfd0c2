/*
 * どこで: Outbound ドメインモデル
 * 何を: 送信メッセージジョブの状態
 * なぜ: lint 結果と配信結果を同じ列で追跡するため
 */
package com.example.leadengine.model;

import java.util.EnumSet;
import java.util.Set;

public enum OutboundMessageStatus {
  QUEUED,
  RENDERED,
  SENDING,
  SENT,
  DELIVERED,
  BOUNCED,
  PAUSED,
  FAILED;

  /** 返信や抑止で一時停止の対象になる未送信状態。 */
  public static Set<OutboundMessageStatus> pausable() {
    return EnumSet.of(QUEUED, RENDERED);
  }
}
