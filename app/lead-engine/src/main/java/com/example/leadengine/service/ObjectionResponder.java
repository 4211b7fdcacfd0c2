/*
 * どこで: Lead Engine サービス層
 * 何を: 異議の種類に応じた承認済みテンプレートから返信下書きを組み立てる
 * なぜ: 異議への返答を自由生成させず、登録済みの文面と予約リンクに限定するため
 */
package com.example.leadengine.service;

import com.example.leadengine.collaborator.CannedMessages;
import com.example.leadengine.collaborator.MessageDraft;
import com.example.leadengine.model.ObjectionTemplate;
import com.example.leadengine.repository.ObjectionTemplateRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ObjectionResponder {

  private static final Logger logger = LoggerFactory.getLogger(ObjectionResponder.class);
  static final int MAX_NAMED_ITEMS = 3;
  static final String NO_ITEMS_PLACEHOLDER = "relevant lines";

  private final ObjectionTemplateRepository objectionTemplateRepository;
  private final CannedMessages cannedMessages;

  /**
   * 役割: 異議への返信下書きを作る。
   * 動作: 有効なテンプレートがあれば {company_name} / {brand_names} / {booking_link} を埋め、
   * 無ければ汎用文面を返す。本文に予約リンクが無ければ末尾に付ける。
   */
  public MessageDraft draft(String companyName, String objectionType, List<String> itemNames) {
    final String link = cannedMessages.bookingLink();
    final String defaultSubject = "Re: " + companyName;
    final Optional<ObjectionTemplate> template =
        objectionType == null || objectionType.isBlank()
            ? Optional.empty()
            : objectionTemplateRepository.findActive(objectionType.trim());
    if (template.isEmpty()) {
      logger.info("no objection template; using generic response objectionType={}", objectionType);
      return new MessageDraft(defaultSubject, genericBody(link));
    }
    final String names = brandNames(itemNames);
    String body = render(template.get().templateBody(), companyName, names, link);
    if (!body.contains(link)) {
      body = body + "\n\n" + link;
    }
    final String subject =
        template.get().templateSubject() == null || template.get().templateSubject().isBlank()
            ? defaultSubject
            : render(template.get().templateSubject(), companyName, names, link);
    return new MessageDraft(subject, body);
  }

  static String brandNames(List<String> itemNames) {
    if (itemNames == null || itemNames.isEmpty()) {
      return NO_ITEMS_PLACEHOLDER;
    }
    return String.join(", ", itemNames.subList(0, Math.min(MAX_NAMED_ITEMS, itemNames.size())));
  }

  private static String render(String text, String companyName, String names, String link) {
    return text.replace("{company_name}", companyName)
        .replace("{brand_names}", names)
        .replace("{booking_link}", link);
  }

  private static String genericBody(String link) {
    return "Totally understand.\n\n"
        + "Happy to share a few relevant lines that might fit. "
        + "Best way is a quick call so I can understand your needs.\n\n"
        + link;
  }
}
