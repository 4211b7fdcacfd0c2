package com.example.leadengine.api;

import com.example.leadengine.api.request.ReplyDecisionRequest;
import com.example.leadengine.api.response.ReplyResponse;
import com.example.leadengine.service.ReplyApprovalService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** 返信下書きの人手承認キュー。 */
@RestController
@RequestMapping("/v1/replies")
@RequiredArgsConstructor
public class ReplyController {

  private final ReplyApprovalService replyApprovalService;

  @GetMapping("/pending")
  public ResponseEntity<List<ReplyResponse>> pending(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    return ResponseEntity.ok(
        replyApprovalService.pending(limit).stream().map(ReplyResponse::from).toList());
  }

  @PostMapping("/{replyId}/approve")
  public ResponseEntity<ReplyResponse> approve(
      @PathVariable("replyId") UUID replyId, @Valid @RequestBody ReplyDecisionRequest request) {
    return ResponseEntity.ok(
        ReplyResponse.from(replyApprovalService.approve(replyId, request.decidedBy())));
  }

  @PostMapping("/{replyId}/reject")
  public ResponseEntity<ReplyResponse> reject(
      @PathVariable("replyId") UUID replyId, @Valid @RequestBody ReplyDecisionRequest request) {
    return ResponseEntity.ok(
        ReplyResponse.from(replyApprovalService.reject(replyId, request.decidedBy())));
  }
}
