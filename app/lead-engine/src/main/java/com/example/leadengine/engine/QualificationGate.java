/*
 * どこで: Lead 判定エンジン
 * 何を: 固定しきい値でリードの適格/不適格を判定する
 * なぜ: 生成 AI の判断ではなく決定的な 2 つのゲートだけで足切りするため
 */
package com.example.leadengine.engine;

import com.example.leadengine.model.SignalSet;

public final class QualificationGate {

  private final double maxPrivateLabelRatio;
  private final int minSkuEstimate;
  private final int minScaleScore;

  public QualificationGate(double maxPrivateLabelRatio, int minSkuEstimate, int minScaleScore) {
    this.maxPrivateLabelRatio = maxPrivateLabelRatio;
    this.minSkuEstimate = minSkuEstimate;
    this.minScaleScore = minScaleScore;
  }

  /**
   * 役割: シグナルに 2 つのゲートを順に適用する。
   * 動作: private label 比率の超過を先に判定し、次に SKU 数と規模スコアの同時不足を判定する。
   * 前提: SKU 推定値が未取得の場合は 0 とみなす。
   */
  public QualificationVerdict evaluate(SignalSet signals) {
    if (signals.privateLabelRatio() > maxPrivateLabelRatio) {
      return QualificationVerdict.disqualified(QualificationVerdict.PRIVATE_LABEL_ONLY);
    }
    if (signals.skuEstimateOrZero() < minSkuEstimate && signals.scaleScore() < minScaleScore) {
      return QualificationVerdict.disqualified(QualificationVerdict.ARBITRAGE_NO_SCALE);
    }
    return QualificationVerdict.pass();
  }
}
