package com.example.leadengine.engine;

import java.util.List;

public record LintResult(boolean passed, List<LintViolation> violations) {

  public LintResult {
    violations = List.copyOf(violations);
  }

  public static LintResult of(List<LintViolation> violations) {
    return new LintResult(violations.isEmpty(), violations);
  }

  public String summary() {
    return String.join("; ", violations.stream().map(LintViolation::describe).toList());
  }
}
