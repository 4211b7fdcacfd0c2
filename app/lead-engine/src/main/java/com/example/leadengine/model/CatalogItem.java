/*
 * どこで: Catalog ドメインモデル
 * 何を: 販促対象の商品 (ブランド) エントリ
 * なぜ: マッチング中は不変の参照データとして扱うため
 */
package com.example.leadengine.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record CatalogItem(
    long itemId,
    String name,
    List<String> categories,
    double discountPct,
    List<String> channelFit,
    boolean replenishable,
    boolean priority,
    boolean active) {

  private static final String DEFAULT_PRIMARY_CATEGORY = "general";

  public CatalogItem {
    categories = withoutNulls(categories);
    channelFit = withoutNulls(channelFit);
  }

  // カタログ JSON の null 要素は読み飛ばす
  private static List<String> withoutNulls(List<String> values) {
    return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
  }

  /** 多様性判定に使う先頭カテゴリ。未設定なら general。 */
  public String primaryCategory() {
    if (categories.isEmpty() || categories.get(0) == null || categories.get(0).isBlank()) {
      return DEFAULT_PRIMARY_CATEGORY;
    }
    return categories.get(0).trim().toLowerCase(Locale.ROOT);
  }
}
