package com.example.leadengine.service;

import java.util.UUID;

public class LeadNotFoundException extends RuntimeException {

  public LeadNotFoundException(UUID leadId) {
    super("lead not found: " + leadId);
  }
}
