package com.example.leadengine.service;

import java.util.UUID;

public class ReplyNotFoundException extends RuntimeException {

  public ReplyNotFoundException(UUID replyId) {
    super("reply not found: " + replyId);
  }
}
