package com.example.leadengine.collaborator;

public record ReplyClassificationOutcome(ReplyClassificationResult result, String callId) {}
