package com.example.leadengine.api.response;

import com.example.leadengine.service.PipelineStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PipelineStatsResponse(
    int totalLeads,
    Map<String, Integer> leadsByStatus,
    Map<String, Integer> messagesByStatus,
    Map<String, Integer> jobsByStatus,
    Map<String, Integer> repliesByClassification,
    int totalEmails,
    int totalReplies,
    int booked,
    double conversionRate) {

  public static PipelineStatsResponse from(PipelineStats stats) {
    return new PipelineStatsResponse(
        stats.totalLeads(),
        stats.leadsByStatus(),
        stats.messagesByStatus(),
        stats.jobsByStatus(),
        stats.repliesByClassification(),
        stats.totalEmails(),
        stats.totalReplies(),
        stats.booked(),
        stats.conversionRate());
  }
}
