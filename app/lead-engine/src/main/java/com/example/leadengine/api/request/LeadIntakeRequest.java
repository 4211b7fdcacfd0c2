/*
 * どこで: Lead Engine API リクエスト DTO
 * 何を: リード取り込みの入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.leadengine.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeadIntakeRequest(
    @NotBlank String companyName,
    @NotBlank String websiteUrl,
    @Email String contactEmail,
    String channel,
    String niche,
    String location,
    String notes) {}
