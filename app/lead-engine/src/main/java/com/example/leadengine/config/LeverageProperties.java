package com.example.leadengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadengine.leverage")
public record LeverageProperties(String fallbackAngle, Integer defaultCap) {

  public LeverageProperties {
    if (fallbackAngle == null || fallbackAngle.isBlank()) {
      fallbackAngle = "growth";
    }
    if (defaultCap == null) {
      defaultCap = 3;
    }
  }
}
