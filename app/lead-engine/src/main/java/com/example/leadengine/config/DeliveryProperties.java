/*
 * どこで: Lead Engine の設定バインド
 * 何を: 配信プロバイダの選択と接続先を保持する
 * なぜ: 起動時に 1 度だけプロバイダを決め、下流で種別を意識させないため
 */
package com.example.leadengine.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "leadengine.delivery")
@Validated
public record DeliveryProperties(
    @NotBlank String provider,
    String baseUrl,
    String apiKey,
    String apiKeyHeaderName,
    String campaignLeadsPath) {

  public static final String PROVIDER_LOCAL = "local";
  public static final String PROVIDER_HTTP = "http";

  public DeliveryProperties {
    if (provider == null || provider.isBlank()) {
      provider = PROVIDER_LOCAL;
    }
    if (apiKeyHeaderName == null || apiKeyHeaderName.isBlank()) {
      apiKeyHeaderName = "X-Api-Key";
    }
    if (campaignLeadsPath == null || campaignLeadsPath.isBlank()) {
      campaignLeadsPath = "/campaigns/{campaignRef}/leads";
    }
  }

  @AssertTrue(message = "leadengine.delivery.provider must be local or http")
  public boolean isProviderSupported() {
    return PROVIDER_LOCAL.equals(provider) || PROVIDER_HTTP.equals(provider);
  }

  @AssertTrue(message = "leadengine.delivery.base-url is required for http provider")
  public boolean isBaseUrlPresentForHttp() {
    return !PROVIDER_HTTP.equals(provider) || (baseUrl != null && !baseUrl.isBlank());
  }
}
