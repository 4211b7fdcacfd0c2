package com.example.leadengine.collaborator;

import java.util.List;

public record ResearchResult(
    boolean success,
    String platform,
    List<String> categories,
    List<String> sampleItems,
    List<String> brandMentions,
    Integer skuEstimate,
    Double priceMin,
    Double priceMax,
    boolean policyTextFound,
    String policyExcerpt,
    double privateLabelRatio,
    String siteExcerpt,
    String artifactPath,
    String artifactHash,
    String error) {

  public ResearchResult {
    categories = categories == null ? List.of() : List.copyOf(categories);
    sampleItems = sampleItems == null ? List.of() : List.copyOf(sampleItems);
    brandMentions = brandMentions == null ? List.of() : List.copyOf(brandMentions);
  }

  /** 失敗時の既定シグナル。 */
  public static ResearchResult failed(String error) {
    return new ResearchResult(
        false, null, List.of(), List.of(), List.of(), null, null, null, false, null, 0.0, null, null,
        null, error);
  }
}
