/*
 * どこで: Lead Engine サービス層
 * 何を: 状態別件数と予約率を集計する
 * なぜ: 運用者がパイプライン全体の詰まりと成果を 1 回の呼び出しで把握するため
 */
package com.example.leadengine.service;

import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.OutboundMessageStatus;
import com.example.leadengine.repository.JobRepository;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import com.example.leadengine.repository.ReplyRepository;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PipelineStatsService {

  private final LeadRepository leadRepository;
  private final OutboundMessageRepository outboundMessageRepository;
  private final JobRepository jobRepository;
  private final ReplyRepository replyRepository;

  public PipelineStats stats() {
    final Map<String, Integer> leadsByStatus = withAllStatuses(leadRepository.countByStatus());
    final Map<String, Integer> messagesByStatus = outboundMessageRepository.countByStatus();
    final int totalLeads = leadRepository.count();
    final int booked = leadsByStatus.getOrDefault(LeadStatus.BOOKED.name(), 0);
    // DELIVERED/BOUNCED は SENT を経由しているので送信数に含める
    final int totalEmails =
        messagesByStatus.getOrDefault(OutboundMessageStatus.SENT.name(), 0)
            + messagesByStatus.getOrDefault(OutboundMessageStatus.DELIVERED.name(), 0)
            + messagesByStatus.getOrDefault(OutboundMessageStatus.BOUNCED.name(), 0);
    return new PipelineStats(
        totalLeads,
        leadsByStatus,
        messagesByStatus,
        jobRepository.countByStatus(),
        replyRepository.countByClassification(),
        totalEmails,
        replyRepository.count(),
        booked,
        conversionRate(booked, totalLeads));
  }

  /** 予約数 / 総リード数 (%)。小数 1 桁に丸める。 */
  @VisibleForTesting
  static double conversionRate(int booked, int totalLeads) {
    return BigDecimal.valueOf(booked * 100.0 / Math.max(totalLeads, 1))
        .setScale(1, RoundingMode.HALF_UP)
        .doubleValue();
  }

  private static Map<String, Integer> withAllStatuses(Map<String, Integer> counts) {
    final Map<String, Integer> result = new LinkedHashMap<>();
    for (LeadStatus status : LeadStatus.values()) {
      result.put(status.name(), counts.getOrDefault(status.name(), 0));
    }
    return result;
  }
}
