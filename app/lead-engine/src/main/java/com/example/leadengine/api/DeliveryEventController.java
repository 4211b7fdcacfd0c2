package com.example.leadengine.api;

import com.example.leadengine.api.request.DeliveryEventRequest;
import com.example.leadengine.api.response.DeliveryEventResponse;
import com.example.leadengine.service.DeliveryEvent;
import com.example.leadengine.service.DeliveryEventService;
import com.example.leadengine.service.DeliveryEventType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/delivery-events")
@RequiredArgsConstructor
public class DeliveryEventController {

  private final DeliveryEventService deliveryEventService;

  @PostMapping
  public ResponseEntity<DeliveryEventResponse> receive(
      @Valid @RequestBody DeliveryEventRequest request) {
    final DeliveryEvent event =
        new DeliveryEvent(
            DeliveryEventType.fromValue(request.event()),
            request.address(),
            request.providerMessageId(),
            request.replyText());
    return ResponseEntity.ok(DeliveryEventResponse.from(deliveryEventService.handle(event)));
  }
}
