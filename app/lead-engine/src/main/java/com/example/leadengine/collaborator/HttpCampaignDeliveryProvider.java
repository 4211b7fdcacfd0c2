/*
 * どこで: 外部コラボレータ境界
 * 何を: キャンペーン型の送信サービスへリードとメッセージを登録する
 * なぜ: 実際の配信とリトライを送信サービス側に任せるため
 */
package com.example.leadengine.collaborator;

import com.example.leadengine.config.DeliveryProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class HttpCampaignDeliveryProvider implements DeliveryProvider {

  private final RestClient deliveryRestClient;
  private final DeliveryProperties properties;

  public HttpCampaignDeliveryProvider(RestClient deliveryRestClient, DeliveryProperties properties) {
    this.deliveryRestClient = deliveryRestClient;
    this.properties = properties;
  }

  @Override
  public String name() {
    return "http";
  }

  @Override
  public String deliver(DeliveryRequest request) {
    final CampaignLeadRequest body =
        new CampaignLeadRequest(
            request.address(),
            request.leadId(),
            request.messageId(),
            request.touchIndex(),
            request.subject(),
            request.body());
    try {
      final CampaignLeadResponse response =
          deliveryRestClient
              .post()
              .uri(properties.campaignLeadsPath(), request.campaignRef())
              .contentType(MediaType.APPLICATION_JSON)
              .header(properties.apiKeyHeaderName(), properties.apiKey())
              .body(body)
              .retrieve()
              .body(CampaignLeadResponse.class);
      if (response == null || response.messageId() == null || response.messageId().isBlank()) {
        throw new DeliveryException("delivery response has no message id");
      }
      return response.messageId();
    } catch (RestClientResponseException ex) {
      throw new DeliveryException("delivery rejected status=" + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw new DeliveryException("delivery connection failed", ex);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record CampaignLeadRequest(
      String email, UUID leadId, UUID messageId, int touchIndex, String subject, String body) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  record CampaignLeadResponse(String messageId) {}
}
