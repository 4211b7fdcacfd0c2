package com.example.leadengine.engine;

import com.example.leadengine.model.Lead;
import com.example.leadengine.model.SignalSet;
import java.util.List;

/** ルール評価に使うリード属性だけを抜き出した値。 */
public record LeadProfile(
    String channel,
    int scaleScore,
    double privateLabelRatio,
    int mapBehaviorScore,
    int storeCount,
    List<String> brandList) {

  public LeadProfile {
    brandList = brandList == null ? List.of() : List.copyOf(brandList);
  }

  public static LeadProfile of(Lead lead, SignalSet signals) {
    return new LeadProfile(
        lead.channel(),
        signals.scaleScore(),
        signals.privateLabelRatio(),
        signals.mapBehaviorScore(),
        signals.storeCount(),
        signals.brandList());
  }
}
