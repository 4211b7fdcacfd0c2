package com.example.leadengine.engine;

/** 商品スコアリングの設定値。起動時に 1 度だけ組み立てる。 */
public record CatalogScoring(
    double highDiscountThreshold,
    String marketplaceChannel,
    String multiChannelMarker,
    int maxPerPrimaryCategory) {}
