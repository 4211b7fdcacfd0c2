/*
 * どこで: Catalog マッチングエンジン
 * 何を: リードのチャネル/カテゴリに合わせて上限付きの商品セットを選ぶ
 * なぜ: 1 通のメッセージで紹介する商品を少数かつ偏りなく保つため
 */
package com.example.leadengine.engine;

import com.example.leadengine.model.CatalogItem;
import com.example.leadengine.model.ItemSelectionQuery;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public final class CatalogMatcher {

  static final int CHANNEL_FIT_POINTS = 20;
  static final int CATEGORY_OVERLAP_POINTS = 15;
  static final int HIGH_DISCOUNT_POINTS = 10;
  static final int REPLENISHABLE_POINTS = 10;

  private static final Comparator<ScoredItem> RANKING =
      Comparator.comparingInt(ScoredItem::score)
          .thenComparingDouble(scored -> scored.item().discountPct())
          .reversed();

  private final CatalogScoring scoring;

  public CatalogMatcher(CatalogScoring scoring) {
    this.scoring = scoring;
  }

  /**
   * 役割: 有効商品の中から cap 件以内の商品を選ぶ。
   * 動作: 優先商品をスコア順に並べ、足りなければ非優先商品を割引率順に補充し、
   * 先頭カテゴリごとの上限を守りながら先頭から採用する。
   * 前提: 上限違反の候補は読み飛ばすだけで代替は探さない。
   */
  public ItemSelection select(
      List<CatalogItem> catalog, String channel, List<String> leadCategories, ItemSelectionQuery query) {
    final int cap = query.cap() == null ? 0 : Math.max(0, query.cap());
    final boolean priorityFirst = query.priorityFirst() == null || query.priorityFirst();
    final String leadChannel = normalize(channel);
    final Set<String> categories = normalizeAll(leadCategories);

    final List<CatalogItem> active = catalog.stream().filter(CatalogItem::active).toList();
    final List<CatalogItem> candidates =
        priorityFirst ? active.stream().filter(CatalogItem::priority).toList() : active;

    final List<ScoredItem> pool = new ArrayList<>();
    for (CatalogItem item : candidates) {
      pool.add(new ScoredItem(item, score(item, leadChannel, categories)));
    }
    pool.sort(RANKING);

    if (pool.size() < cap) {
      extendWithNonPriority(pool, active, cap);
    }

    final List<ScoredItem> selected = new ArrayList<>();
    final Map<String, Integer> perCategory = new HashMap<>();
    for (ScoredItem scored : pool) {
      if (selected.size() >= cap) {
        break;
      }
      final String primary = scored.item().primaryCategory();
      final int used = perCategory.getOrDefault(primary, 0);
      if (used >= scoring.maxPerPrimaryCategory()) {
        continue;
      }
      perCategory.put(primary, used + 1);
      selected.add(scored);
    }
    return new ItemSelection(selected, candidates.size(), cap);
  }

  int score(CatalogItem item, String leadChannel, Set<String> leadCategories) {
    int score = 0;
    final Set<String> fit = normalizeAll(item.channelFit());
    if ((!leadChannel.isEmpty() && fit.contains(leadChannel))
        || fit.contains(normalize(scoring.multiChannelMarker()))) {
      score += CHANNEL_FIT_POINTS;
    }
    final Set<String> overlap = normalizeAll(item.categories());
    overlap.retainAll(leadCategories);
    score += CATEGORY_OVERLAP_POINTS * overlap.size();
    if (item.discountPct() >= scoring.highDiscountThreshold()) {
      score += HIGH_DISCOUNT_POINTS;
    }
    if (item.replenishable() && leadChannel.equals(normalize(scoring.marketplaceChannel()))) {
      score += REPLENISHABLE_POINTS;
    }
    return score;
  }

  private void extendWithNonPriority(List<ScoredItem> pool, List<CatalogItem> active, int cap) {
    final Set<Long> present = new HashSet<>();
    pool.forEach(scored -> present.add(scored.item().itemId()));
    final List<CatalogItem> extras =
        active.stream()
            .filter(item -> !item.priority())
            .filter(item -> !present.contains(item.itemId()))
            .sorted(Comparator.comparingDouble(CatalogItem::discountPct).reversed())
            .toList();
    for (CatalogItem item : extras) {
      if (pool.size() >= cap) {
        return;
      }
      pool.add(new ScoredItem(item, 0));
    }
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
  }

  private static Set<String> normalizeAll(List<String> values) {
    if (values == null) {
      return new HashSet<>();
    }
    return values.stream()
        .map(CatalogMatcher::normalize)
        .filter(value -> !value.isEmpty())
        .collect(Collectors.toCollection(HashSet::new));
  }
}
