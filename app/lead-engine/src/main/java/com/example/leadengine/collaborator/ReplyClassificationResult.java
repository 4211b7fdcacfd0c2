package com.example.leadengine.collaborator;

import com.example.leadengine.model.ReplyAction;
import com.example.leadengine.model.ReplyClassification;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 返信分類器の厳密 JSON 出力。classification/action は文字列のまま受ける。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplyClassificationResult(
    String classification, String objectionType, String action, Integer interestLevel) {

  public static final ReplyClassificationResult DEFAULT =
      new ReplyClassificationResult("unknown", null, "handoff_to_human", 5);

  public ReplyClassification classificationValue() {
    return ReplyClassification.fromValue(classification);
  }

  public ReplyAction actionValue() {
    return ReplyAction.fromValue(action);
  }

  public boolean isValid() {
    return classification != null
        && action != null
        && (interestLevel == null || (interestLevel >= 1 && interestLevel <= 10));
  }
}
