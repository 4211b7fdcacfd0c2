package com.example.leadengine.service;

import com.example.leadengine.engine.LintViolation;
import java.util.List;
import java.util.UUID;

/**
 * created=false は変数セットのリント違反で何も保存しなかったことを表す。
 */
public record SequenceResult(
    boolean created,
    UUID sequenceId,
    List<UUID> messageIds,
    int renderedCount,
    int failedCount,
    List<LintViolation> violations) {

  public SequenceResult {
    messageIds = List.copyOf(messageIds);
    violations = List.copyOf(violations);
  }

  static SequenceResult lintFailed(List<LintViolation> violations) {
    return new SequenceResult(false, null, List.of(), 0, 0, violations);
  }
}
