package com.example.leadengine.model;

import java.util.Locale;

/** 返信に対して取れる行動の閉じた集合。 */
public enum ReplyAction {
  SEND_CALENDAR,
  SEND_CURATED_CATALOG,
  SUPPRESS,
  HANDOFF_TO_HUMAN;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ReplyAction fromValue(String value) {
    if (value == null) {
      return HANDOFF_TO_HUMAN;
    }
    for (ReplyAction action : values()) {
      if (action.value().equalsIgnoreCase(value.trim())) {
        return action;
      }
    }
    return HANDOFF_TO_HUMAN;
  }
}
