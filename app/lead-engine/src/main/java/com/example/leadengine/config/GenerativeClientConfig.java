/*
 * どこで: Lead Engine 設定
 * 何を: 生成テキストクライアントと構造化出力リーダーを組み立てる
 * なぜ: API キーの有無を起動時に 1 度だけ判定し、未設定なら既定値経路へ縮退させるため
 */
package com.example.leadengine.config;

import com.example.leadengine.collaborator.DisabledGenerativeTextClient;
import com.example.leadengine.collaborator.GenerativeTextClient;
import com.example.leadengine.collaborator.MessagesApiTextClient;
import com.example.leadengine.collaborator.StructuredOutputReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class GenerativeClientConfig {

  private static final Logger logger = LoggerFactory.getLogger(GenerativeClientConfig.class);

  @Bean
  GenerativeTextClient generativeTextClient(
      RestClient.Builder builder, GenerativeProperties properties) {
    if (!properties.hasApiKey()) {
      logger.warn("generative api key is not set; classifiers and generator will use defaults");
      return new DisabledGenerativeTextClient();
    }
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    // 生成サービス呼び出し専用 RestClient。
    final RestClient restClient =
        builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
    return new MessagesApiTextClient(restClient, properties);
  }

  @Bean
  StructuredOutputReader structuredOutputReader(
      GenerativeTextClient generativeTextClient, ObjectMapper objectMapper) {
    return new StructuredOutputReader(generativeTextClient, objectMapper);
  }
}
