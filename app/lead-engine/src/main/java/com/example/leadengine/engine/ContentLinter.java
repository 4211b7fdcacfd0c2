/*
 * どこで: コンテンツポリシー
 * 何を: 件名/本文と生成前の変数セットを禁止語句と商品数上限で検査する
 * なぜ: 送信前にすべてのメッセージを同じ基準でゲートするため
 */
package com.example.leadengine.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class ContentLinter {

  static final String SUBJECT = "subject";
  static final String BODY = "body";
  static final String ITEMS = "items";
  static final String VARIABLES = "variables";

  private final ContentPolicy policy;
  private final List<String> loweredPhrases;

  public ContentLinter(ContentPolicy policy) {
    this.policy = policy;
    this.loweredPhrases =
        policy.forbiddenPhrases().stream().map(phrase -> phrase.toLowerCase(Locale.ROOT)).toList();
  }

  public ContentPolicy policy() {
    return policy;
  }

  /**
   * 役割: 1 通分のメッセージを検査する。
   * 動作: 件名と本文それぞれで禁止語句を大文字小文字を無視して探し、参照商品数が上限を超えれば違反を追加する。
   * 前提: subject/body/itemNames が null の場合のみ例外とし、通常の違反は戻り値で返す。
   */
  public LintResult lint(String subject, String body, List<String> itemNames) {
    requireInput(subject, "subject");
    requireInput(body, "body");
    requireInput(itemNames, "itemNames");
    final List<LintViolation> violations = new ArrayList<>();
    scan(subject, SUBJECT, violations);
    scan(body, BODY, violations);
    final int distinctItems = new LinkedHashSet<>(itemNames).size();
    if (distinctItems > policy.maxItemsPerMessage()) {
      violations.add(
          new LintViolation(
              LintViolation.ITEM_CAP,
              ITEMS,
              distinctItems + " items exceeds cap " + policy.maxItemsPerMessage()));
    }
    return LintResult.of(violations);
  }

  /** 生成前の変数セットを検査する。 */
  public LintResult lintVariables(MessageVariables variables) {
    requireInput(variables, "variables");
    final List<LintViolation> violations = new ArrayList<>();
    if (variables.itemNames().size() > policy.maxItemsPerMessage()) {
      violations.add(
          new LintViolation(
              LintViolation.ITEM_CAP,
              VARIABLES,
              variables.itemNames().size() + " item names exceeds cap " + policy.maxItemsPerMessage()));
    }
    for (String key : policy.forbiddenVariableKeys()) {
      final String value = findIgnoreCase(variables.extras(), key);
      if (value != null && !value.isBlank()) {
        violations.add(new LintViolation(LintViolation.FORBIDDEN_VARIABLE, VARIABLES, key));
      }
    }
    return LintResult.of(violations);
  }

  private void scan(String text, String location, List<LintViolation> violations) {
    final String lowered = text.toLowerCase(Locale.ROOT);
    for (String phrase : loweredPhrases) {
      if (lowered.contains(phrase)) {
        violations.add(new LintViolation(LintViolation.FORBIDDEN_PHRASE, location, phrase));
      }
    }
  }

  private static void requireInput(Object value, String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private static String findIgnoreCase(Map<String, String> extras, String key) {
    for (Map.Entry<String, String> entry : extras.entrySet()) {
      if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(key)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
