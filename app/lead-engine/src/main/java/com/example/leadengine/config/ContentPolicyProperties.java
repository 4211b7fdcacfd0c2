/*
 * どこで: Lead Engine の設定バインド
 * 何を: 禁止語句/禁止変数キー/商品数上限を保持する
 * なぜ: 未設定時も既定のポリシーで必ず検査できるようにするため
 */
package com.example.leadengine.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadengine.content-policy")
public record ContentPolicyProperties(
    Integer maxItemsPerMessage, List<String> forbiddenPhrases, List<String> forbiddenVariableKeys) {

  static final List<String> DEFAULT_FORBIDDEN_PHRASES =
      List.of(
          "cost basis",
          "invoice",
          "exclusivity",
          "exclusive deal",
          "full catalog",
          "complete catalog",
          "entire catalog",
          "detailed margin",
          "margin structure",
          "percent off",
          "% off retail",
          "wholesale price",
          "wholesale cost",
          "our cost",
          "your cost",
          "cost per unit",
          "direct authorized",
          "authorized distributor",
          "map violation",
          "below map",
          "grey market",
          "gray market",
          "diversion",
          "liquidation");

  static final List<String> DEFAULT_FORBIDDEN_VARIABLE_KEYS =
      List.of("catalog_url", "full_catalog", "price_list", "invoice");

  public ContentPolicyProperties {
    if (maxItemsPerMessage == null) {
      maxItemsPerMessage = 3;
    }
    if (forbiddenPhrases == null || forbiddenPhrases.isEmpty()) {
      forbiddenPhrases = DEFAULT_FORBIDDEN_PHRASES;
    }
    if (forbiddenVariableKeys == null || forbiddenVariableKeys.isEmpty()) {
      forbiddenVariableKeys = DEFAULT_FORBIDDEN_VARIABLE_KEYS;
    }
  }
}
