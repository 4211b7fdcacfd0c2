package com.example.leadengine.service;

import java.util.UUID;

/** matched が false のときは該当メッセージ/リードが見つからず何も変更していない。 */
public record DeliveryEventResult(
    DeliveryEventType type,
    boolean matched,
    UUID leadId,
    UUID messageId,
    ReplyOutcome replyOutcome) {

  static DeliveryEventResult unmatched(DeliveryEventType type) {
    return new DeliveryEventResult(type, false, null, null, null);
  }
}
