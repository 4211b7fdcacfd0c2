/*
 * どこで: 外部コラボレータ境界
 * 何を: Messages API 形式の生成テキストサービスを RestClient で呼び出す
 * なぜ: 分類器と文面生成が共通の接続設定を使うため
 */
package com.example.leadengine.collaborator;

import com.example.leadengine.config.GenerativeProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class MessagesApiTextClient implements GenerativeTextClient {

  static final String API_KEY_HEADER = "x-api-key";
  static final String VERSION_HEADER = "anthropic-version";
  static final String API_VERSION = "2023-06-01";

  private final RestClient generativeRestClient;
  private final GenerativeProperties properties;

  public MessagesApiTextClient(RestClient generativeRestClient, GenerativeProperties properties) {
    this.generativeRestClient = generativeRestClient;
    this.properties = properties;
  }

  @Override
  public boolean enabled() {
    return true;
  }

  @Override
  public String complete(String prompt) {
    final MessagesRequest request =
        new MessagesRequest(
            properties.model(), properties.maxTokens(), List.of(new Message("user", prompt)));
    try {
      final MessagesResponse response =
          generativeRestClient
              .post()
              .uri(properties.completionPath())
              .contentType(MediaType.APPLICATION_JSON)
              .header(API_KEY_HEADER, properties.apiKey())
              .header(VERSION_HEADER, API_VERSION)
              .body(request)
              .retrieve()
              .body(MessagesResponse.class);
      return firstText(response);
    } catch (RestClientResponseException ex) {
      throw new GenerativeClientException(
          "generative request failed status=" + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw new GenerativeClientException("generative request connection failed", ex);
    }
  }

  private String firstText(MessagesResponse response) {
    if (response == null || response.content() == null || response.content().isEmpty()) {
      throw new GenerativeClientException("generative response has no content");
    }
    final ContentBlock block = response.content().get(0);
    if (block.text() == null) {
      throw new GenerativeClientException("generative response has no text block");
    }
    return block.text();
  }

  record MessagesRequest(
      String model, @JsonProperty("max_tokens") int maxTokens, List<Message> messages) {}

  record Message(String role, String content) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MessagesResponse(List<ContentBlock> content) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ContentBlock(String type, String text) {}
}
