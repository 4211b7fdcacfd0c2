/*
 * どこで: Lead Engine サービス層
 * 何を: 閉じた語彙の監査イベントを audit_log に追記する
 * なぜ: 状態変更と同じトランザクションで因果の記録を残すため
 */
package com.example.leadengine.service;

import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.repository.AuditLogRepository;
import com.example.leadengine.repository.JsonColumns;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditLedger {

  private static final Logger logger = LoggerFactory.getLogger(AuditLedger.class);

  private final AuditLogRepository auditLogRepository;
  private final JsonColumns jsonColumns;
  private final Clock clock;

  /**
   * 役割: 1 件の監査エントリを追記する。
   * 前提: 呼び出し側のトランザクションに参加する。単独で呼ばれた場合は自動コミットで書かれる。
   */
  public long record(
      String correlationId,
      AuditEvent event,
      UUID leadId,
      UUID jobId,
      String actor,
      Map<String, Object> payload) {
    final String payloadJson = jsonColumns.write(payload == null ? Map.of() : payload);
    final long auditId =
        auditLogRepository.insert(
            correlationId, event, leadId, jobId, actor, payloadJson, Instant.now(clock));
    logger.debug(
        "audit recorded event={} leadId={} jobId={} correlationId={}",
        event.value(),
        leadId,
        jobId,
        correlationId);
    return auditId;
  }

  /** null 値を許す順序付きペイロード。引数はキーと値を交互に並べる。 */
  public static Map<String, Object> payload(Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("payload requires key/value pairs");
    }
    final Map<String, Object> payload = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      payload.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return payload;
  }
}
