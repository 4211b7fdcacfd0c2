package com.example.leadengine.collaborator;

public record ClassificationOutcome(ClassificationResult result, String callId, boolean usedDefault) {}
