/*
 * どこで: Lead Engine サービス層
 * 何を: 商談予約と商談後の結果ラベルを記録する
 * なぜ: 予約済みリードを以後の自動送信から外し、成約状況を集計できるようにするため
 */
package com.example.leadengine.service;

import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadOutcome;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class LeadOutcomeService {

  private static final Logger logger = LoggerFactory.getLogger(LeadOutcomeService.class);

  private final LeadRepository leadRepository;
  private final OutboundMessageRepository outboundMessageRepository;
  private final LeadTransitions leadTransitions;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: リードを BOOKED にする。
   * 動作: booked_at を記録し、未送信のシーケンスを止める。
   * 前提: 遷移元が許可されていなければ InvalidLeadTransitionException。
   */
  public Lead book(UUID leadId) {
    requireLead(leadId);
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              leadTransitions.require(leadId, LeadStatus.BOOKED, null, now);
              outboundMessageRepository.pauseActiveSequence(List.of(leadId), now);
            });
    logger.info("lead booked leadId={}", leadId);
    return requireLead(leadId);
  }

  /** 結果ラベルを付ける。deal_in_progress は未予約なら予約も行う。 */
  public Lead recordOutcome(UUID leadId, LeadOutcome outcome, String notes) {
    if (outcome == null) {
      throw new IllegalArgumentException("outcome is required");
    }
    final Lead lead = requireLead(leadId);
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              leadRepository.updateOutcome(leadId, outcome, notes, now);
              if (outcome == LeadOutcome.DEAL_IN_PROGRESS && lead.status() != LeadStatus.BOOKED) {
                leadTransitions.require(leadId, LeadStatus.BOOKED, null, now);
                outboundMessageRepository.pauseActiveSequence(List.of(leadId), now);
              }
            });
    logger.info("lead outcome recorded leadId={} outcome={}", leadId, outcome.value());
    return requireLead(leadId);
  }

  private Lead requireLead(UUID leadId) {
    return leadRepository.findById(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
  }
}
