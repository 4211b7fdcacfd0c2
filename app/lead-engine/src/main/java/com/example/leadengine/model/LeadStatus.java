/*
 * どこで: Lead ドメインモデル
 * 何を: リードのライフサイクル状態と許可される遷移元を定義する
 * なぜ: 状態更新を条件付き UPDATE で守り、逆行や終端からの復帰を防ぐため
 */
package com.example.leadengine.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum LeadStatus {
  NEW,
  RESEARCHED,
  QUALIFIED,
  DISQUALIFIED,
  CONTACTED,
  INTERESTED,
  OBJECTION,
  DEAD,
  BOOKED;

  private static final Map<LeadStatus, Set<LeadStatus>> SOURCES = new EnumMap<>(LeadStatus.class);

  static {
    SOURCES.put(NEW, EnumSet.noneOf(LeadStatus.class));
    SOURCES.put(RESEARCHED, EnumSet.of(NEW));
    SOURCES.put(QUALIFIED, EnumSet.of(RESEARCHED));
    SOURCES.put(DISQUALIFIED, EnumSet.of(RESEARCHED));
    SOURCES.put(CONTACTED, EnumSet.of(QUALIFIED));
    SOURCES.put(INTERESTED, EnumSet.of(CONTACTED, OBJECTION));
    SOURCES.put(OBJECTION, EnumSet.of(CONTACTED));
    // 抑止はどの状態からでも DEAD へ落とせる
    SOURCES.put(DEAD, EnumSet.complementOf(EnumSet.of(DEAD)));
    SOURCES.put(BOOKED, EnumSet.of(CONTACTED, INTERESTED, OBJECTION));
  }

  /** この状態へ遷移してよい元状態の集合。 */
  public Set<LeadStatus> sources() {
    return Collections.unmodifiableSet(SOURCES.get(this));
  }

  public boolean canTransitionFrom(LeadStatus from) {
    return SOURCES.get(this).contains(from);
  }

  public boolean isTerminal() {
    return this == DISQUALIFIED || this == DEAD || this == BOOKED;
  }
}
