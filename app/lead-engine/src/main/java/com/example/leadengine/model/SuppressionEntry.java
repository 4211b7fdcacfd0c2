package com.example.leadengine.model;

import java.time.Instant;
import java.util.UUID;

/** address が null の行はドメイン単位の抑止を表す。 */
public record SuppressionEntry(
    long suppressionId,
    String address,
    String domain,
    String reason,
    UUID sourceLeadId,
    Instant createdAt) {}
