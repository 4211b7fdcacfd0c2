package com.example.leadengine.service;

import com.example.leadengine.model.AuditEntry;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeverageAssignment;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.repository.AuditLogRepository;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.LeverageAssignmentRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import com.example.leadengine.repository.ReplyRepository;
import com.example.leadengine.repository.SignalSetRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** 運用 API 向けの読み取り専用クエリ。 */
@Service
@RequiredArgsConstructor
public class LeadQueryService {

  private final LeadRepository leadRepository;
  private final SignalSetRepository signalSetRepository;
  private final LeverageAssignmentRepository leverageAssignmentRepository;
  private final OutboundMessageRepository outboundMessageRepository;
  private final ReplyRepository replyRepository;
  private final AuditLogRepository auditLogRepository;
  private final SelectedItemNames selectedItemNames;

  public LeadDetail detail(UUID leadId) {
    final Lead lead =
        leadRepository.findById(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
    final LeverageAssignment leverage =
        leverageAssignmentRepository.findByLeadId(leadId).orElse(null);
    return new LeadDetail(
        lead,
        signalSetRepository.findByLeadId(leadId).orElse(null),
        leverage,
        leverage == null ? List.of() : selectedItemNames.names(leverage.selectedItemIds()),
        outboundMessageRepository.findByLeadId(leadId),
        replyRepository.findByLeadId(leadId));
  }

  public List<Lead> recent(int limit) {
    return leadRepository.findRecent(limit);
  }

  /** leadId 指定時はそのリードの履歴を古い順、未指定なら全体の新しい順。 */
  public List<AuditEntry> audit(UUID leadId, int limit) {
    if (leadId == null) {
      return auditLogRepository.findRecent(limit);
    }
    return auditLogRepository.findByLeadId(leadId, limit);
  }

  public List<OutboundMessage> failedMessages(int limit) {
    return outboundMessageRepository.findFailed(limit);
  }
}
