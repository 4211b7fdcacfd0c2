package com.example.leadengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadengine.seed")
public record SeedProperties(boolean enabled, String location) {

  public SeedProperties {
    if (location == null || location.isBlank()) {
      location = "classpath:seed/";
    }
  }
}
