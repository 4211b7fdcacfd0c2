/*
 * どこで: Lead Engine 運用 API
 * 何を: キュー消化/送信の手動起動、統計、監査ログ、失敗メッセージ一覧を公開する
 * なぜ: スケジューラを待たずに運用者がパイプラインを操作し、状態を確認するため
 */
package com.example.leadengine.api;

import com.example.leadengine.api.response.AuditEntryResponse;
import com.example.leadengine.api.response.DispatchResponse;
import com.example.leadengine.api.response.DrainResponse;
import com.example.leadengine.api.response.OutboundMessageResponse;
import com.example.leadengine.api.response.PipelineStatsResponse;
import com.example.leadengine.service.DispatchResult;
import com.example.leadengine.service.DrainResult;
import com.example.leadengine.service.LeadQueryService;
import com.example.leadengine.service.LeadQueueDrainService;
import com.example.leadengine.service.OutboundDispatchService;
import com.example.leadengine.service.PipelineStatsService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

  private final LeadQueueDrainService drainService;
  private final OutboundDispatchService dispatchService;
  private final PipelineStatsService statsService;
  private final LeadQueryService leadQueryService;

  @PostMapping("/drain")
  public ResponseEntity<DrainResponse> drain() {
    final DrainResult result = drainService.drain();
    return ResponseEntity.ok(
        new DrainResponse(result.processed(), result.skipped(), result.failed()));
  }

  @PostMapping("/dispatch")
  public ResponseEntity<DispatchResponse> dispatch() {
    final DispatchResult result = dispatchService.dispatchDue();
    return ResponseEntity.ok(
        new DispatchResponse(result.claimed(), result.sent(), result.paused(), result.failed()));
  }

  @GetMapping("/stats")
  public ResponseEntity<PipelineStatsResponse> stats() {
    return ResponseEntity.ok(PipelineStatsResponse.from(statsService.stats()));
  }

  @GetMapping("/audit")
  public ResponseEntity<List<AuditEntryResponse>> audit(
      @RequestParam(name = "lead_id", required = false) UUID leadId,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return ResponseEntity.ok(
        leadQueryService.audit(leadId, limit).stream().map(AuditEntryResponse::from).toList());
  }

  @GetMapping("/failed-messages")
  public ResponseEntity<List<OutboundMessageResponse>> failedMessages(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    return ResponseEntity.ok(
        leadQueryService.failedMessages(limit).stream().map(OutboundMessageResponse::from).toList());
  }
}
