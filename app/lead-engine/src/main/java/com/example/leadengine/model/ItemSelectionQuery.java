/*
 * どこで: Leverage ドメインモデル
 * 何を: ルールが指定する商品選定クエリ (優先商品を先に使うか / 上限数)
 * なぜ: lead_leverage に選定条件をそのまま残し、再現可能にするため
 */
package com.example.leadengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ItemSelectionQuery(
    @JsonProperty("priority_first") Boolean priorityFirst, @JsonProperty("cap") Integer cap) {

  public static ItemSelectionQuery defaults(int cap) {
    return new ItemSelectionQuery(true, cap);
  }

  /** 欠けた項目を既定値で埋め、既定値を含めて上限を maxCap に丸める。 */
  public ItemSelectionQuery normalized(int defaultCap, int maxCap) {
    final int requested = cap == null ? defaultCap : cap;
    final int resolvedCap = Math.max(0, Math.min(requested, maxCap));
    return new ItemSelectionQuery(priorityFirst == null || priorityFirst, resolvedCap);
  }
}
