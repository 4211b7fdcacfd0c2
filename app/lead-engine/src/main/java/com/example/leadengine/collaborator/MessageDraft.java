package com.example.leadengine.collaborator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageDraft(String subject, String body) {

  public boolean isValid() {
    return subject != null && !subject.isBlank() && body != null && !body.isBlank();
  }
}
