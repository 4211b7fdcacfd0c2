/*
 * どこで: Leverage ルールエンジン
 * 何を: 有効ルールを優先度昇順に評価し、最初に一致したルールの angle を返す
 * なぜ: 同じ入力から常に同じ戦略が選ばれ、監査で根拠を説明できるようにするため
 */
package com.example.leadengine.engine;

import com.example.leadengine.model.ItemSelectionQuery;
import com.example.leadengine.model.LeverageRule;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class LeverageRuleEngine {

  public static final String NO_RULES_LOADED = "no_rules_loaded_fallback";
  public static final String NO_RULE_MATCHED = "no_rule_matched_fallback";

  private static final Comparator<LeverageRule> EVALUATION_ORDER =
      Comparator.comparingInt(LeverageRule::priority).thenComparingLong(LeverageRule::ruleId);

  private final String fallbackAngle;
  private final int defaultCap;
  private final int maxCap;

  public LeverageRuleEngine(String fallbackAngle, int defaultCap, int maxCap) {
    this.fallbackAngle = fallbackAngle;
    this.defaultCap = defaultCap;
    this.maxCap = maxCap;
  }

  public LeverageDecision decide(List<LeverageRule> rules, LeadProfile profile) {
    final List<LeverageRule> active =
        rules.stream().filter(LeverageRule::active).sorted(EVALUATION_ORDER).toList();
    if (active.isEmpty()) {
      return fallback(NO_RULES_LOADED);
    }
    final Optional<LeverageRule> winner =
        active.stream().filter(rule -> matches(rule, profile)).findFirst();
    return winner.map(this::toDecision).orElseGet(() -> fallback(NO_RULE_MATCHED));
  }

  /** ルールの null でない述語がすべて成立するか。 */
  public static boolean matches(LeverageRule rule, LeadProfile profile) {
    return Arrays.stream(RuleCondition.values())
        .filter(condition -> condition.appliesTo(rule))
        .allMatch(condition -> condition.holds(rule, profile));
  }

  private LeverageDecision toDecision(LeverageRule rule) {
    final ItemSelectionQuery query =
        rule.selectionQuery() == null
            ? defaultQuery()
            : rule.selectionQuery().normalized(defaultCap, maxCap);
    final String reason =
        rule.description() == null || rule.description().isBlank()
            ? "rule_" + rule.priority() + "_matched"
            : rule.description();
    return new LeverageDecision(
        rule.ruleId(), rule.primaryAngle(), rule.secondaryAngle(), reason, false, query);
  }

  private LeverageDecision fallback(String reason) {
    return new LeverageDecision(
        null, fallbackAngle, null, reason, true, defaultQuery());
  }

  // 既定上限も maxCap を超えない
  private ItemSelectionQuery defaultQuery() {
    return ItemSelectionQuery.defaults(Math.min(defaultCap, maxCap));
  }
}
