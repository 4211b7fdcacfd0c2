/*
 * どこで: Lead Engine API
 * 何を: リードの取り込み/参照/予約/結果記録/返信受付のエンドポイントを公開する
 * なぜ: 運用者と上流システムがパイプラインへリードを投入し、進捗を確認する入口を提供するため
 */
package com.example.leadengine.api;

import com.example.leadengine.api.request.LeadIntakeRequest;
import com.example.leadengine.api.request.LeadOutcomeRequest;
import com.example.leadengine.api.request.ReplyRequest;
import com.example.leadengine.api.response.LeadDetailResponse;
import com.example.leadengine.api.response.LeadIntakeResponse;
import com.example.leadengine.api.response.LeadResponse;
import com.example.leadengine.api.response.ReplyOutcomeResponse;
import com.example.leadengine.model.LeadOutcome;
import com.example.leadengine.service.IntakeResult;
import com.example.leadengine.service.LeadIntakeCommand;
import com.example.leadengine.service.LeadIntakeService;
import com.example.leadengine.service.LeadOutcomeService;
import com.example.leadengine.service.LeadQueryService;
import com.example.leadengine.service.ReplyCommand;
import com.example.leadengine.service.ReplyHandlingService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/leads")
@RequiredArgsConstructor
public class LeadController {

  static final String HEADER_OPERATOR = "X-Operator-Id";
  static final String DEFAULT_OPERATOR = "operator";

  private final LeadIntakeService leadIntakeService;
  private final LeadQueryService leadQueryService;
  private final LeadOutcomeService leadOutcomeService;
  private final ReplyHandlingService replyHandlingService;

  @PostMapping
  public ResponseEntity<LeadIntakeResponse> intake(
      @RequestHeader(name = HEADER_OPERATOR, defaultValue = DEFAULT_OPERATOR) String operator,
      @Valid @RequestBody LeadIntakeRequest request) {
    final IntakeResult result =
        leadIntakeService.intake(
            new LeadIntakeCommand(
                request.companyName(),
                request.websiteUrl(),
                request.contactEmail(),
                request.channel(),
                request.niche(),
                request.location(),
                request.notes()),
            operator);
    final HttpStatus status =
        result.outcome() == IntakeResult.Outcome.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status)
        .body(
            new LeadIntakeResponse(
                result.outcome().name().toLowerCase(Locale.ROOT),
                result.leadId() == null ? null : result.leadId().toString(),
                result.jobId() == null ? null : result.jobId().toString()));
  }

  @GetMapping
  public ResponseEntity<List<LeadResponse>> recent(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    return ResponseEntity.ok(
        leadQueryService.recent(limit).stream().map(LeadResponse::from).toList());
  }

  @GetMapping("/{leadId}")
  public ResponseEntity<LeadDetailResponse> detail(@PathVariable("leadId") UUID leadId) {
    return ResponseEntity.ok(LeadDetailResponse.from(leadQueryService.detail(leadId)));
  }

  @PostMapping("/{leadId}/book")
  public ResponseEntity<LeadResponse> book(@PathVariable("leadId") UUID leadId) {
    return ResponseEntity.ok(LeadResponse.from(leadOutcomeService.book(leadId)));
  }

  @PostMapping("/{leadId}/outcome")
  public ResponseEntity<LeadResponse> outcome(
      @PathVariable("leadId") UUID leadId, @Valid @RequestBody LeadOutcomeRequest request) {
    return ResponseEntity.ok(
        LeadResponse.from(
            leadOutcomeService.recordOutcome(
                leadId, LeadOutcome.fromValue(request.outcome()), request.notes())));
  }

  @PostMapping("/{leadId}/replies")
  public ResponseEntity<ReplyOutcomeResponse> reply(
      @PathVariable("leadId") UUID leadId,
      @RequestHeader(name = HEADER_OPERATOR, defaultValue = DEFAULT_OPERATOR) String operator,
      @Valid @RequestBody ReplyRequest request) {
    return ResponseEntity.ok(
        ReplyOutcomeResponse.from(
            replyHandlingService.handleReply(
                new ReplyCommand(
                    leadId, request.text(), request.outboundMessageId(), request.providerMessageId()),
                operator)));
  }
}
