/*
 * どこで: Leverage ドメインモデル
 * 何を: 優先度順に評価されるマッチングルール
 * なぜ: null でない述語のみを AND 評価する宣言的な形で保持するため
 */
package com.example.leadengine.model;

public record LeverageRule(
    long ruleId,
    int priority,
    boolean active,
    String channelMatch,
    Integer minScaleScore,
    Double maxPrivateLabelRatio,
    Integer minMapBehavior,
    Integer minStoreCount,
    boolean requiresBrandOverlap,
    boolean requiresAdjacentBrands,
    String primaryAngle,
    String secondaryAngle,
    ItemSelectionQuery selectionQuery,
    String description) {}
