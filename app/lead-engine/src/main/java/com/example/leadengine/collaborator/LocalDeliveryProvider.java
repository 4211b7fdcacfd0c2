/*
 * どこで: 外部コラボレータ境界
 * 何を: 送信を模擬するプロバイダ
 * なぜ: 外部送信を伴わずに状態遷移を確認するため
 */
package com.example.leadengine.collaborator;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalDeliveryProvider implements DeliveryProvider {

  private static final Logger logger = LoggerFactory.getLogger(LocalDeliveryProvider.class);

  @Override
  public String name() {
    return "local";
  }

  @Override
  public String deliver(DeliveryRequest request) {
    // 実送信は行わず、ログに残すだけとする
    final String providerMessageId = "local-" + UUID.randomUUID();
    logger.info(
        "outbound simulated send messageId={} leadId={} touch={} providerMessageId={}",
        request.messageId(),
        request.leadId(),
        request.touchIndex(),
        providerMessageId);
    return providerMessageId;
  }
}
