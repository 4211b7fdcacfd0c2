/*
 * どこで: Lead ドメインモデル
 * 何を: 調査結果 (raw) と分類結果 (AI 正規化) をまとめたシグナル
 * なぜ: リードごとに 1 行を upsert し、判定根拠を後から辿れるようにするため
 */
package com.example.leadengine.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SignalSet(
    UUID leadId,
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
    List<String> brandList,
    String priceTier,
    int scaleScore,
    int mapBehaviorScore,
    int storeCount,
    String artifactPath,
    String artifactHash,
    boolean researchSucceeded,
    String researchError,
    Instant classifiedAt) {

  public SignalSet {
    categories = categories == null ? List.of() : List.copyOf(categories);
    sampleItems = sampleItems == null ? List.of() : List.copyOf(sampleItems);
    brandMentions = brandMentions == null ? List.of() : List.copyOf(brandMentions);
    brandList = brandList == null ? List.of() : List.copyOf(brandList);
  }

  public int skuEstimateOrZero() {
    return skuEstimate == null ? 0 : skuEstimate;
  }

  public SignalSet withClassification(
      List<String> brandList,
      String priceTier,
      int scaleScore,
      int mapBehaviorScore,
      int storeCount,
      Instant classifiedAt) {
    return new SignalSet(
        leadId,
        platform,
        categories,
        sampleItems,
        brandMentions,
        skuEstimate,
        priceMin,
        priceMax,
        policyTextFound,
        policyExcerpt,
        privateLabelRatio,
        siteExcerpt,
        brandList,
        priceTier,
        scaleScore,
        mapBehaviorScore,
        storeCount,
        artifactPath,
        artifactHash,
        researchSucceeded,
        researchError,
        classifiedAt);
  }
}
