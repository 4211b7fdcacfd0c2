package com.example.leadengine.collaborator;

import java.time.Duration;
import java.util.UUID;

/** budget と maxPages は呼び出し側が守らせる上限。 */
public record ResearchRequest(String url, UUID leadId, Duration budget, int maxPages) {}
