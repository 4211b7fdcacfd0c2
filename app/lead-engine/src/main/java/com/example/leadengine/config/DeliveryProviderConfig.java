/*
 * どこで: Lead Engine 設定
 * 何を: 設定値から配信プロバイダを 1 つ選んで Bean にする
 * なぜ: 下流のサービスがプロバイダの種別を判定しないようにするため
 */
package com.example.leadengine.config;

import com.example.leadengine.collaborator.DeliveryProvider;
import com.example.leadengine.collaborator.HttpCampaignDeliveryProvider;
import com.example.leadengine.collaborator.LocalDeliveryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class DeliveryProviderConfig {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryProviderConfig.class);

  @Bean
  DeliveryProvider deliveryProvider(RestClient.Builder builder, DeliveryProperties properties) {
    logger.info("delivery provider selected provider={}", properties.provider());
    if (DeliveryProperties.PROVIDER_HTTP.equals(properties.provider())) {
      return new HttpCampaignDeliveryProvider(builder.baseUrl(properties.baseUrl()).build(), properties);
    }
    return new LocalDeliveryProvider();
  }
}
