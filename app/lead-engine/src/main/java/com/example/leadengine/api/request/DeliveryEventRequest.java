/*
 * どこで: Lead Engine API リクエスト DTO
 * 何を: 配信プロバイダ webhook を正規化した入力を定義する
 * なぜ: プロバイダ固有の形式を API 境界の外で吸収させるため
 */
package com.example.leadengine.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryEventRequest(
    @NotBlank String event, String address, String providerMessageId, String replyText) {}
