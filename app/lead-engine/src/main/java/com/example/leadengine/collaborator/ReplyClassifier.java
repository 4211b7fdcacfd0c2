package com.example.leadengine.collaborator;

public interface ReplyClassifier {

  ReplyClassificationOutcome classify(String replyText, String context);
}
