package com.example.leadengine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 生成テキストサービスの接続設定。api-key 未設定時は無効化クライアントに切り替わる。 */
@ConfigurationProperties(prefix = "leadengine.generative")
public record GenerativeProperties(
    String apiKey,
    String baseUrl,
    String completionPath,
    String model,
    Integer maxTokens,
    Duration timeout) {

  public GenerativeProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = "https://api.anthropic.com";
    }
    if (completionPath == null || completionPath.isBlank()) {
      completionPath = "/v1/messages";
    }
    if (model == null || model.isBlank()) {
      model = "claude-sonnet-4-20250514";
    }
    if (maxTokens == null) {
      maxTokens = 1024;
    }
    if (timeout == null) {
      timeout = Duration.ofSeconds(30);
    }
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
