package com.example.leadengine.service;

import java.util.Map;

public record PipelineStats(
    int totalLeads,
    Map<String, Integer> leadsByStatus,
    Map<String, Integer> messagesByStatus,
    Map<String, Integer> jobsByStatus,
    Map<String, Integer> repliesByClassification,
    int totalEmails,
    int totalReplies,
    int booked,
    double conversionRate) {}
