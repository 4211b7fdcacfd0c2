/*
 * どこで: 外部コラボレータ境界
 * 何を: 返信本文を分類し、取るべき行動を返す
 * なぜ: 返信処理のステートマシンへ閉じた語彙で判断材料を渡すため
 */
package com.example.leadengine.collaborator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GenerativeReplyClassifier implements ReplyClassifier {

  static final String REPAIR_EXAMPLE =
      "{\"classification\":\"unknown\",\"objection_type\":null,"
          + "\"action\":\"handoff_to_human\",\"interest_level\":5}";

  private static final String PROMPT =
      """
      You are classifying an inbound email reply from a sales lead.
      Context: %s

      Reply text:
      %s

      Return STRICT JSON only:
      {"classification": "interested"|"objection"|"not_interested"|"unsubscribe"|"out_of_office"|"unknown",
       "objection_type": null|string,
       "action": "send_calendar"|"send_curated_catalog"|"suppress"|"handoff_to_human",
       "interest_level": 1-10}
      """;

  private final StructuredOutputReader structuredOutputReader;

  @Override
  public ReplyClassificationOutcome classify(String replyText, String context) {
    final StructuredOutput<ReplyClassificationResult> output =
        structuredOutputReader.read(
            PROMPT.formatted(context, replyText),
            REPAIR_EXAMPLE,
            ReplyClassificationResult.class,
            ReplyClassificationResult::isValid,
            ReplyClassificationResult.DEFAULT);
    return new ReplyClassificationOutcome(output.value(), output.callId());
  }
}
