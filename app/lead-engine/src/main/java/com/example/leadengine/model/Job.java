package com.example.leadengine.model;

import java.time.Instant;
import java.util.UUID;

public record Job(
    UUID jobId,
    JobType jobType,
    UUID leadId,
    JobStatus status,
    int attempts,
    String lockedBy,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt) {}
