package com.example.leadengine.model;

import java.time.Instant;
import java.util.UUID;

public record QualificationRecord(
    UUID leadId,
    boolean qualified,
    String disqualifyReason,
    String classifierCallId,
    String schemaVersion,
    Instant evaluatedAt) {}
