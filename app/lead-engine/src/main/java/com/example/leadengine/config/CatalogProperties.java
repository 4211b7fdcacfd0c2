package com.example.leadengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadengine.catalog")
public record CatalogProperties(
    Double priorityDiscountThreshold,
    Double highDiscountThreshold,
    String marketplaceChannel,
    String multiChannelMarker,
    Integer maxPerPrimaryCategory) {

  public CatalogProperties {
    // 割引率 45% 以上を優先商品として扱う
    if (priorityDiscountThreshold == null) {
      priorityDiscountThreshold = 45.0;
    }
    if (highDiscountThreshold == null) {
      highDiscountThreshold = 60.0;
    }
    if (marketplaceChannel == null) {
      marketplaceChannel = "amazon";
    }
    if (multiChannelMarker == null) {
      multiChannelMarker = "multi-channel";
    }
    if (maxPerPrimaryCategory == null) {
      maxPerPrimaryCategory = 2;
    }
  }
}
