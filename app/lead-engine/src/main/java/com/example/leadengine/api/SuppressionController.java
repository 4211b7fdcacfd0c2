package com.example.leadengine.api;

import com.example.leadengine.api.request.SuppressionRequest;
import com.example.leadengine.api.response.SuppressionEntryResponse;
import com.example.leadengine.api.response.SuppressionResponse;
import com.example.leadengine.service.CorrelationIds;
import com.example.leadengine.service.SuppressionService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** 手動抑止。削除エンドポイントは持たない。 */
@RestController
@RequestMapping("/v1/suppressions")
@RequiredArgsConstructor
public class SuppressionController {

  private final SuppressionService suppressionService;

  @PostMapping("/addresses")
  public ResponseEntity<SuppressionResponse> suppressAddress(
      @RequestHeader(name = LeadController.HEADER_OPERATOR, defaultValue = LeadController.DEFAULT_OPERATOR)
          String operator,
      @Valid @RequestBody SuppressionRequest request) {
    return ResponseEntity.ok(
        SuppressionResponse.from(
            suppressionService.suppressAddress(
                request.value(), request.reason(), null, operator, CorrelationIds.current())));
  }

  @PostMapping("/domains")
  public ResponseEntity<SuppressionResponse> suppressDomain(
      @RequestHeader(name = LeadController.HEADER_OPERATOR, defaultValue = LeadController.DEFAULT_OPERATOR)
          String operator,
      @Valid @RequestBody SuppressionRequest request) {
    return ResponseEntity.ok(
        SuppressionResponse.from(
            suppressionService.suppressDomain(
                request.value(), request.reason(), operator, CorrelationIds.current())));
  }

  @GetMapping
  public ResponseEntity<List<SuppressionEntryResponse>> recent(
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return ResponseEntity.ok(
        suppressionService.recent(limit).stream().map(SuppressionEntryResponse::from).toList());
  }
}
