package com.example.leadengine.service;

import java.util.UUID;

public record IntakeResult(Outcome outcome, UUID leadId, UUID jobId) {

  public enum Outcome {
    CREATED,
    DEDUPLICATED,
    SUPPRESSED
  }

  static IntakeResult created(UUID leadId, UUID jobId) {
    return new IntakeResult(Outcome.CREATED, leadId, jobId);
  }

  static IntakeResult deduplicated(UUID leadId) {
    return new IntakeResult(Outcome.DEDUPLICATED, leadId, null);
  }

  static IntakeResult suppressed() {
    return new IntakeResult(Outcome.SUPPRESSED, null, null);
  }

  public boolean deduplicated() {
    return outcome == Outcome.DEDUPLICATED;
  }
}
