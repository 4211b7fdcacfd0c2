/*
 * どこで: 外部コラボレータ境界
 * 何を: 定型文面 (コールド文面の代替 / 興味あり返信) を組み立てる
 * なぜ: 生成サービスが使えない時でも安全な文面で処理を継続するため
 */
package com.example.leadengine.collaborator;

import com.example.leadengine.config.ReplyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CannedMessages {

  private final ReplyProperties replyProperties;

  public MessageDraft coldOutreach(String companyName, String niche) {
    final String subject = companyName + ": quick brand sourcing idea";
    final String body =
        "Hi,\n\nNoticed your "
            + nicheOrDefault(niche)
            + " catalog. We source premium brands at competitive terms.\n\nWorth a quick chat?\n\n"
            + replyProperties.bookingLink();
    return new MessageDraft(subject, body);
  }

  public MessageDraft interestedResponse(String companyName) {
    final String body =
        "Perfect.\n\nGrab a quick "
            + replyProperties.meetingDuration()
            + " here:\n"
            + replyProperties.bookingLink()
            + "\n\n"
            + replyProperties.meetingDays()
            + ", "
            + replyProperties.meetingHours()
            + " works best.\n\nTitle: "
            + replyProperties.meetingTitleTemplate().replace("{company_name}", companyName);
    return new MessageDraft("Re: " + companyName, body);
  }

  public String bookingLink() {
    return replyProperties.bookingLink();
  }

  private static String nicheOrDefault(String niche) {
    return niche == null || niche.isBlank() ? "store" : niche;
  }
}
