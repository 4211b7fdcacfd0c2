package com.example.leadengine.service;

import com.example.leadengine.model.LeadStatus;
import java.util.UUID;

/** 許可された遷移元に無い状態から遷移しようとした。 */
public class InvalidLeadTransitionException extends RuntimeException {

  private final UUID leadId;
  private final LeadStatus target;

  public InvalidLeadTransitionException(UUID leadId, LeadStatus target) {
    super("lead " + leadId + " cannot move to " + target);
    this.leadId = leadId;
    this.target = target;
  }

  public UUID leadId() {
    return leadId;
  }

  public LeadStatus target() {
    return target;
  }
}
