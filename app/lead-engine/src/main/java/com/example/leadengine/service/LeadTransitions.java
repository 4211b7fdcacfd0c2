/*
 * どこで: Lead Engine サービス層
 * 何を: リードの状態遷移を条件付き UPDATE で適用する
 * なぜ: 不正な遷移を no-op として扱い、呼び出し側へ結果を返すため
 */
package com.example.leadengine.service;

import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.repository.LeadRepository;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LeadTransitions {

  private static final Logger logger = LoggerFactory.getLogger(LeadTransitions.class);

  private final LeadRepository leadRepository;

  /** 遷移できた場合 true。遷移元が許可されていなければ何もせず false。 */
  public boolean apply(UUID leadId, LeadStatus target, String reason, Instant now) {
    final int updated = leadRepository.transition(leadId, target, reason, now);
    if (updated == 0) {
      logger.warn("lead transition rejected leadId={} target={}", leadId, target);
      return false;
    }
    logger.info("lead transitioned leadId={} status={}", leadId, target);
    return true;
  }

  /** 遷移できなければ InvalidLeadTransitionException。トランザクション内ではロールバックを伴う。 */
  public void require(UUID leadId, LeadStatus target, String reason, Instant now) {
    if (!apply(leadId, target, reason, now)) {
      throw new InvalidLeadTransitionException(leadId, target);
    }
  }
}
