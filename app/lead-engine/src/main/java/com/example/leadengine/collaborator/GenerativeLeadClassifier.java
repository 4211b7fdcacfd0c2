/*
 * どこで: 外部コラボレータ境界
 * 何を: 生成テキストサービスでリードのシグナルを正規化する
 * なぜ: ブランド一覧や規模スコアなどの非構造データを数値化するため
 */
package com.example.leadengine.collaborator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GenerativeLeadClassifier implements LeadClassifier {

  static final String REPAIR_EXAMPLE =
      "{\"brand_list\":[],\"price_tier\":\"mixed\",\"scale_score\":0,"
          + "\"map_behavior_score\":0,\"store_count\":0,\"qualifies\":true,\"disqualify_reason\":null}";

  private static final String PROMPT =
      """
      You are a lead qualification analyst for a distributor of branded products.
      Analyze the storefront signals below and return a STRICT JSON object only.

      Signals:
      - Platform: %s
      - Categories: %s
      - Brand mentions: %s
      - SKU estimate: %s
      - Price range: %s - %s
      - Site excerpt: %s
      - Pricing policy text found: %s
      - Company: %s
      - Niche: %s

      Schema:
      {"brand_list": [string], "price_tier": "luxury"|"mid"|"discount"|"mixed",
       "scale_score": 0-100, "map_behavior_score": 0-100, "store_count": integer,
       "qualifies": boolean, "disqualify_reason": null|string}
      """;

  private final StructuredOutputReader structuredOutputReader;

  @Override
  public ClassificationOutcome classify(ClassificationInput input, String companyName, String niche) {
    final String prompt =
        PROMPT.formatted(
            input.platform(),
            input.categories(),
            input.brandMentions(),
            input.skuEstimate(),
            input.priceMin(),
            input.priceMax(),
            input.siteExcerpt(),
            input.policyTextFound(),
            companyName,
            niche);
    final StructuredOutput<ClassificationResult> output =
        structuredOutputReader.read(
            prompt,
            REPAIR_EXAMPLE,
            ClassificationResult.class,
            ClassificationResult::isValid,
            ClassificationResult.DEFAULT);
    return new ClassificationOutcome(output.value(), output.callId(), output.usedDefault());
  }
}
