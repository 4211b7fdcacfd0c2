/*
 * どこで: 返信処理
 * 何を: 返信本文に明示的な配信停止の意思表示が含まれるかを判定する
 * なぜ: 分類器の結果に関わらず抑止を優先するため
 */
package com.example.leadengine.engine;

import java.util.List;
import java.util.Locale;

public final class OptOutDetector {

  private final List<String> phrases;

  public OptOutDetector(List<String> phrases) {
    this.phrases = phrases.stream().map(OptOutDetector::normalize).toList();
  }

  public boolean isOptOut(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    final String normalized = normalize(text);
    return phrases.stream().anyMatch(normalized::contains);
  }

  // 全角アポストロフィと連続空白を揃える
  private static String normalize(String text) {
    return text.toLowerCase(Locale.ROOT).replace('’', '\'').replaceAll("\\s+", " ").trim();
  }
}
