package com.example.leadengine.engine;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** rule は forbidden_phrase / item_cap / forbidden_variable のいずれか。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LintViolation(String rule, String location, String detail) {

  public static final String FORBIDDEN_PHRASE = "forbidden_phrase";
  public static final String ITEM_CAP = "item_cap";
  public static final String FORBIDDEN_VARIABLE = "forbidden_variable";

  public String describe() {
    return rule + "@" + location + ": " + detail;
  }
}
