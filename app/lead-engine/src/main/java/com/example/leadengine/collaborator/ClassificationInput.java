package com.example.leadengine.collaborator;

import com.example.leadengine.model.SignalSet;
import java.util.List;

/** 分類器へ渡す調査シグナルのスナップショット。 */
public record ClassificationInput(
    String platform,
    List<String> categories,
    List<String> brandMentions,
    Integer skuEstimate,
    Double priceMin,
    Double priceMax,
    String siteExcerpt,
    boolean policyTextFound) {

  public static ClassificationInput of(SignalSet signals) {
    return new ClassificationInput(
        signals.platform(),
        signals.categories(),
        signals.brandMentions(),
        signals.skuEstimate(),
        signals.priceMin(),
        signals.priceMax(),
        signals.siteExcerpt(),
        signals.policyTextFound());
  }
}
