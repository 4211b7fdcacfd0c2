/*
 * どこで: Lead Engine 設定
 * 何を: 設定レコードから不変のポリシー値と純粋コンポーネントを組み立てる
 * なぜ: ルールエンジンやリンタがグローバル状態を読まずに済むようにするため
 */
package com.example.leadengine.config;

import com.example.leadengine.engine.CatalogMatcher;
import com.example.leadengine.engine.CatalogScoring;
import com.example.leadengine.engine.ContentLinter;
import com.example.leadengine.engine.ContentPolicy;
import com.example.leadengine.engine.LeverageRuleEngine;
import com.example.leadengine.engine.OptOutDetector;
import com.example.leadengine.engine.QualificationGate;
import com.example.leadengine.engine.SequenceTiming;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PolicyConfig {

  @Bean
  ContentPolicy contentPolicy(ContentPolicyProperties properties) {
    return new ContentPolicy(
        properties.maxItemsPerMessage(),
        properties.forbiddenPhrases(),
        properties.forbiddenVariableKeys());
  }

  @Bean
  ContentLinter contentLinter(ContentPolicy contentPolicy) {
    return new ContentLinter(contentPolicy);
  }

  @Bean
  QualificationGate qualificationGate(QualificationProperties properties) {
    return new QualificationGate(
        properties.maxPrivateLabelRatio(), properties.minSkuEstimate(), properties.minScaleScore());
  }

  @Bean
  LeverageRuleEngine leverageRuleEngine(LeverageProperties properties, ContentPolicy contentPolicy) {
    // 選定数はメッセージあたりの商品上限を超えない
    return new LeverageRuleEngine(
        properties.fallbackAngle(), properties.defaultCap(), contentPolicy.maxItemsPerMessage());
  }

  @Bean
  CatalogMatcher catalogMatcher(CatalogProperties properties) {
    return new CatalogMatcher(
        new CatalogScoring(
            properties.highDiscountThreshold(),
            properties.marketplaceChannel(),
            properties.multiChannelMarker(),
            properties.maxPerPrimaryCategory()));
  }

  @Bean
  OptOutDetector optOutDetector(ReplyProperties properties) {
    return new OptOutDetector(properties.optOutPhrases());
  }

  @Bean
  SequenceTiming sequenceTiming(SequenceProperties properties) {
    return new SequenceTiming(properties.touchDelays());
  }
}
