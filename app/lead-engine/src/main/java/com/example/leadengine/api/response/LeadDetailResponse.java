package com.example.leadengine.api.response;

import com.example.leadengine.service.LeadDetail;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeadDetailResponse(
    LeadResponse lead,
    SignalResponse signals,
    LeverageResponse leverage,
    List<OutboundMessageResponse> messages,
    List<ReplyResponse> replies) {

  public static LeadDetailResponse from(LeadDetail detail) {
    return new LeadDetailResponse(
        LeadResponse.from(detail.lead()),
        SignalResponse.from(detail.signals()),
        LeverageResponse.from(detail.leverage(), detail.selectedItemNames()),
        detail.messages().stream().map(OutboundMessageResponse::from).toList(),
        detail.replies().stream().map(ReplyResponse::from).toList());
  }
}
