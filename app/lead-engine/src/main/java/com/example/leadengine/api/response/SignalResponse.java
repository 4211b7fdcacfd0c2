package com.example.leadengine.api.response;

import com.example.leadengine.model.SignalSet;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SignalResponse(
    String platform,
    List<String> categories,
    List<String> brandList,
    Integer skuEstimate,
    String priceTier,
    int scaleScore,
    int mapBehaviorScore,
    int storeCount,
    double privateLabelRatio,
    boolean researchSucceeded,
    String researchError) {

  public static SignalResponse from(SignalSet signals) {
    if (signals == null) {
      return null;
    }
    return new SignalResponse(
        signals.platform(),
        signals.categories(),
        signals.brandList(),
        signals.skuEstimate(),
        signals.priceTier(),
        signals.scaleScore(),
        signals.mapBehaviorScore(),
        signals.storeCount(),
        signals.privateLabelRatio(),
        signals.researchSucceeded(),
        signals.researchError());
  }
}
