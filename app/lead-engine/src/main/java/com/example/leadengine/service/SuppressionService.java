/*
 * どこで: Lead Engine サービス層
 * 何を: 抑止リストへの登録/照会と、対象リードの停止を行う
 * なぜ: 一度抑止した相手へ二度と送信しないことを全経路で保証するため
 */
package com.example.leadengine.service;

import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.SuppressionEntry;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import com.example.leadengine.repository.SuppressionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class SuppressionService {

  private static final Logger logger = LoggerFactory.getLogger(SuppressionService.class);
  static final String DEAD_REASON_PREFIX = "suppressed: ";

  private final SuppressionRepository suppressionRepository;
  private final LeadRepository leadRepository;
  private final OutboundMessageRepository outboundMessageRepository;
  private final AuditLedger auditLedger;
  private final LeadEngineMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public boolean isSuppressed(String address) {
    final String normalized = normalizeAddress(address);
    return suppressionRepository.isSuppressed(normalized, domainOf(normalized));
  }

  /**
   * 役割: アドレスを恒久的に抑止する。
   * 動作: 未登録なら登録と suppression_added を書き、同じ連絡先のリードを DEAD にして未送信分を止める。
   * 前提: 既に登録済みでも停止処理は行う。
   */
  public SuppressionResult suppressAddress(
      String address, String reason, UUID sourceLeadId, String actor, String correlationId) {
    final String normalized = normalizeAddress(address);
    final String domain = domainOf(normalized);
    final Instant now = Instant.now(clock);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final SuppressionResult result =
        transactionTemplate.execute(
            status -> {
              final boolean added =
                  suppressionRepository.insertAddress(normalized, domain, reason, sourceLeadId, now)
                      > 0;
              if (added) {
                auditLedger.record(
                    correlationId,
                    AuditEvent.SUPPRESSION_ADDED,
                    sourceLeadId,
                    null,
                    actor,
                    AuditLedger.payload("address", normalized, "domain", domain, "reason", reason));
              }
              final List<UUID> dead =
                  leadRepository.markDeadByAddress(normalized, DEAD_REASON_PREFIX + reason, now);
              final Set<UUID> affected =
                  new LinkedHashSet<>(leadRepository.findIdsByContactEmail(normalized));
              return stopLeads(
                  normalized, domain, added, dead, affected, sourceLeadId, reason, actor,
                  correlationId, now);
            });
    if (result.added()) {
      metrics.recordSuppression(reason);
    }
    logger.info(
        "address suppressed domain={} reason={} added={} deadLeads={} pausedMessages={}",
        domain,
        reason,
        result.added(),
        result.deadLeadIds().size(),
        result.pausedMessages());
    return result;
  }

  /** ドメイン単位の抑止。ドメイン配下の全連絡先が対象になる。 */
  public SuppressionResult suppressDomain(
      String domain, String reason, String actor, String correlationId) {
    final String normalized = normalizeDomain(domain);
    final Instant now = Instant.now(clock);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final SuppressionResult result =
        transactionTemplate.execute(
            status -> {
              final boolean added =
                  suppressionRepository.insertDomain(normalized, reason, null, now) > 0;
              if (added) {
                auditLedger.record(
                    correlationId,
                    AuditEvent.SUPPRESSION_ADDED,
                    null,
                    null,
                    actor,
                    AuditLedger.payload("address", null, "domain", normalized, "reason", reason));
              }
              final List<UUID> dead =
                  leadRepository.markDeadByDomain(normalized, DEAD_REASON_PREFIX + reason, now);
              final Set<UUID> affected =
                  new LinkedHashSet<>(leadRepository.findIdsByContactDomain(normalized));
              return stopLeads(
                  null, normalized, added, dead, affected, null, reason, actor, correlationId, now);
            });
    if (result.added()) {
      metrics.recordSuppression(reason);
    }
    logger.info(
        "domain suppressed domain={} reason={} added={} deadLeads={} pausedMessages={}",
        normalized,
        reason,
        result.added(),
        result.deadLeadIds().size(),
        result.pausedMessages());
    return result;
  }

  public List<SuppressionEntry> recent(int limit) {
    return suppressionRepository.findRecent(limit);
  }

  private SuppressionResult stopLeads(
      String address,
      String domain,
      boolean added,
      List<UUID> dead,
      Set<UUID> affected,
      UUID sourceLeadId,
      String reason,
      String actor,
      String correlationId,
      Instant now) {
    for (UUID leadId : dead) {
      auditLedger.record(
          correlationId,
          AuditEvent.LEAD_SUPPRESSED,
          leadId,
          null,
          actor,
          AuditLedger.payload("reason", reason, "domain", domain));
    }
    affected.addAll(dead);
    if (sourceLeadId != null) {
      affected.add(sourceLeadId);
    }
    final int paused = outboundMessageRepository.pauseActiveSequence(affected, now);
    return new SuppressionResult(address, domain, added, dead, paused);
  }

  /** 前後空白を除いた小文字。@ を含まない値は受け付けない。 */
  public static String normalizeAddress(String address) {
    if (address == null) {
      throw new IllegalArgumentException("address is required");
    }
    final String normalized = address.trim().toLowerCase(Locale.ROOT);
    final int at = normalized.lastIndexOf('@');
    if (at <= 0 || at == normalized.length() - 1) {
      throw new IllegalArgumentException("invalid email address: " + address);
    }
    return normalized;
  }

  public static String domainOf(String normalizedAddress) {
    return normalizedAddress.substring(normalizedAddress.lastIndexOf('@') + 1);
  }

  static String normalizeDomain(String domain) {
    if (domain == null || domain.isBlank()) {
      throw new IllegalArgumentException("domain is required");
    }
    final String normalized = domain.trim().toLowerCase(Locale.ROOT);
    return normalized.startsWith("@") ? normalized.substring(1) : normalized;
  }
}
