/*
 * どこで: 外部コラボレータ境界
 * 何を: リード分類器の厳密 JSON 出力
 * なぜ: スキーマ検証と既定値をひとところにまとめるため
 */
package com.example.leadengine.collaborator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationResult(
    List<String> brandList,
    String priceTier,
    Integer scaleScore,
    Integer mapBehaviorScore,
    Integer storeCount,
    Boolean qualifies,
    String disqualifyReason) {

  static final Set<String> PRICE_TIERS = Set.of("luxury", "mid", "discount", "mixed");

  public static final ClassificationResult DEFAULT =
      new ClassificationResult(List.of(), "mixed", 0, 0, 0, true, null);

  public ClassificationResult {
    brandList = brandList == null ? List.of() : List.copyOf(brandList);
  }

  public boolean isValid() {
    return inScore(scaleScore)
        && inScore(mapBehaviorScore)
        && storeCount != null
        && storeCount >= 0
        && priceTier != null
        && PRICE_TIERS.contains(priceTier);
  }

  private static boolean inScore(Integer value) {
    return value != null && value >= 0 && value <= 100;
  }
}
