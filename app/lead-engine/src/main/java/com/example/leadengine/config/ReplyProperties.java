/*
 * どこで: Lead Engine の設定バインド
 * 何を: 返信処理の承認しきい値/予約リンク/配信停止フレーズを保持する
 * なぜ: 人手承認の件数や文面の差し込み値を運用で調整するため
 */
package com.example.leadengine.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "leadengine.reply")
@Validated
public record ReplyProperties(
    @PositiveOrZero int humanApprovalThreshold,
    @NotBlank String bookingLink,
    String meetingDuration,
    String meetingDays,
    String meetingHours,
    String meetingTitleTemplate,
    Integer previewLength,
    List<String> optOutPhrases) {

  static final List<String> DEFAULT_OPT_OUT_PHRASES =
      List.of(
          "unsubscribe",
          "remove me",
          "remove my",
          "stop emailing",
          "stop contacting",
          "opt out",
          "opt-out",
          "take me off",
          "don't email",
          "do not email",
          "do not contact",
          "don't contact",
          "no more emails",
          "stop sending",
          "not interested please remove",
          "please remove");

  public ReplyProperties {
    if (meetingDuration == null) {
      meetingDuration = "30 min";
    }
    if (meetingDays == null) {
      meetingDays = "Mon-Thu";
    }
    if (meetingHours == null) {
      meetingHours = "11am-4pm EST";
    }
    if (meetingTitleTemplate == null) {
      meetingTitleTemplate = "Intro x {company_name}";
    }
    if (previewLength == null) {
      previewLength = 100;
    }
    if (optOutPhrases == null || optOutPhrases.isEmpty()) {
      optOutPhrases = DEFAULT_OPT_OUT_PHRASES;
    }
  }
}
