/*
 * どこで: 外部コラボレータ境界
 * 何を: タッチ番号ごとの構成で送信文面を生成する
 * なぜ: 文面の生成を外部に任せ、コアは検査と保存だけを担うため
 */
package com.example.leadengine.collaborator;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GenerativeMessageGenerator implements MessageGenerator {

  static final int EXCERPT_LIMIT = 500;

  private static final Map<Integer, String> TOUCH_FRAMEWORKS =
      Map.of(
          1, "Cold intro. Mention something specific about their store. End with the calendar link.",
          2, "Follow-up. Quick and casual. Reference the first note. Calendar link.",
          3, "Value add. Share a brief insight about their niche. Position a meeting as next step.",
          4, "Social proof. Reference types of retailers served, never names. Quick meeting push.",
          5, "Last touch. Respectful note that you are available if timing changes. Calendar link.");

  private static final String PROMPT =
      """
      Write a short outreach email for this lead.
      Company: %s
      Niche: %s
      Angle: %s
      Touch: %d
      Framework: %s
      Items to mention: %s
      Store categories: %s
      Store excerpt: %s
      Calendar link: %s

      Return ONLY a JSON object: {"subject": "...", "body": "..."}
      Keep the body under 120 words, short paragraphs, end with the calendar link.
      Never mention pricing, margins, costs or the full catalog.
      """;

  private static final String REPAIR_EXAMPLE = "{\"subject\":\"...\",\"body\":\"...\"}";

  private final StructuredOutputReader structuredOutputReader;
  private final CannedMessages cannedMessages;

  @Override
  public MessageDraft generate(MessageRequest request) {
    final MessageDraft fallback = cannedMessages.coldOutreach(request.companyName(), request.niche());
    final String excerpt =
        request.siteExcerpt() == null
            ? ""
            : request.siteExcerpt().substring(0, Math.min(EXCERPT_LIMIT, request.siteExcerpt().length()));
    final String prompt =
        PROMPT.formatted(
            request.companyName(),
            request.niche(),
            request.angle(),
            request.touchIndex(),
            TOUCH_FRAMEWORKS.getOrDefault(request.touchIndex(), TOUCH_FRAMEWORKS.get(1)),
            request.itemNames().isEmpty() ? "none specific" : String.join(", ", request.itemNames()),
            String.join(", ", request.categories()),
            excerpt,
            cannedMessages.bookingLink());
    return structuredOutputReader
        .read(prompt, REPAIR_EXAMPLE, MessageDraft.class, MessageDraft::isValid, fallback)
        .value();
  }
}
