package com.example.leadengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadengine.qualification")
public record QualificationProperties(
    Double maxPrivateLabelRatio, Integer minSkuEstimate, Integer minScaleScore, String schemaVersion) {

  public QualificationProperties {
    if (maxPrivateLabelRatio == null) {
      maxPrivateLabelRatio = 0.95;
    }
    if (minSkuEstimate == null) {
      minSkuEstimate = 10;
    }
    if (minScaleScore == null) {
      minScaleScore = 20;
    }
    if (schemaVersion == null || schemaVersion.isBlank()) {
      schemaVersion = "2026_02_15_001";
    }
  }
}
