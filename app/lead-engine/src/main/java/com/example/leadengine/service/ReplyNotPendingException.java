package com.example.leadengine.service;

import java.util.UUID;

/** 承認/却下済み、または下書きの無い返信に判断を下そうとした。 */
public class ReplyNotPendingException extends RuntimeException {

  public ReplyNotPendingException(UUID replyId) {
    super("reply is not pending approval: " + replyId);
  }
}
