package com.example.leadengine;

import com.example.leadengine.model.CatalogItem;
import com.example.leadengine.model.ItemSelectionQuery;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.LeverageRule;
import com.example.leadengine.model.SignalSet;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public final class Fixtures {

  public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private Fixtures() {}

  public static Lead lead(UUID leadId, String email, String channel, LeadStatus status) {
    return lead(leadId, "https://acme.example", email, channel, status);
  }

  public static Lead lead(
      UUID leadId, String websiteUrl, String email, String channel, LeadStatus status) {
    return new Lead(
        leadId,
        "Acme Shop",
        websiteUrl,
        email,
        channel,
        "home goods",
        "Austin",
        null,
        status,
        null,
        null,
        null,
        null,
        NOW,
        NOW);
  }

  public static SignalSet signals(
      UUID leadId, double privateLabelRatio, Integer skuEstimate, int scaleScore) {
    return new SignalSet(
        leadId,
        "shopify",
        List.of("home", "kitchen"),
        List.of(),
        List.of(),
        skuEstimate,
        10.0,
        80.0,
        false,
        null,
        privateLabelRatio,
        null,
        List.of(),
        "mid",
        scaleScore,
        0,
        0,
        null,
        null,
        true,
        null,
        null);
  }

  public static CatalogItem item(
      long id, String name, String category, double discount, List<String> channelFit, boolean priority) {
    return new CatalogItem(id, name, List.of(category), discount, channelFit, false, priority, true);
  }

  public static LeverageRule channelRule(long id, int priority, String channel, String angle) {
    return new LeverageRule(
        id,
        priority,
        true,
        channel,
        null,
        null,
        null,
        null,
        false,
        false,
        angle,
        null,
        new ItemSelectionQuery(true, 3),
        null);
  }
}
