/*
 * どこで: Lead Engine データアクセス
 * 何を: lead_signals の upsert と取得を担う
 * なぜ: リードごとにシグナルを 1 行だけ保持し、分類結果で上書きするため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.SignalSet;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SignalSetRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  public int upsert(SignalSet signals, Instant now) {
    final String sql =
        """
        INSERT INTO lead_signals (
          lead_id, platform, categories, sample_items, brand_mentions, sku_estimate,
          price_min, price_max, policy_text_found, policy_excerpt, private_label_ratio,
          site_excerpt, brand_list, price_tier, scale_score, map_behavior_score, store_count,
          artifact_path, artifact_hash, research_succeeded, research_error, classified_at,
          created_at, updated_at
        ) VALUES (
          :leadId, :platform, :categories::jsonb, :sampleItems::jsonb, :brandMentions::jsonb, :skuEstimate,
          :priceMin, :priceMax, :policyTextFound, :policyExcerpt, :privateLabelRatio,
          :siteExcerpt, :brandList::jsonb, :priceTier, :scaleScore, :mapBehaviorScore, :storeCount,
          :artifactPath, :artifactHash, :researchSucceeded, :researchError, :classifiedAt,
          :now, :now
        )
        ON CONFLICT (lead_id) DO UPDATE SET
          platform = EXCLUDED.platform,
          categories = EXCLUDED.categories,
          sample_items = EXCLUDED.sample_items,
          brand_mentions = EXCLUDED.brand_mentions,
          sku_estimate = EXCLUDED.sku_estimate,
          price_min = EXCLUDED.price_min,
          price_max = EXCLUDED.price_max,
          policy_text_found = EXCLUDED.policy_text_found,
          policy_excerpt = EXCLUDED.policy_excerpt,
          private_label_ratio = EXCLUDED.private_label_ratio,
          site_excerpt = EXCLUDED.site_excerpt,
          brand_list = EXCLUDED.brand_list,
          price_tier = EXCLUDED.price_tier,
          scale_score = EXCLUDED.scale_score,
          map_behavior_score = EXCLUDED.map_behavior_score,
          store_count = EXCLUDED.store_count,
          artifact_path = EXCLUDED.artifact_path,
          artifact_hash = EXCLUDED.artifact_hash,
          research_succeeded = EXCLUDED.research_succeeded,
          research_error = EXCLUDED.research_error,
          classified_at = EXCLUDED.classified_at,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leadId", signals.leadId())
            .addValue("platform", signals.platform())
            .addValue("categories", jsonColumns.write(signals.categories()))
            .addValue("sampleItems", jsonColumns.write(signals.sampleItems()))
            .addValue("brandMentions", jsonColumns.write(signals.brandMentions()))
            .addValue("skuEstimate", signals.skuEstimate())
            .addValue("priceMin", signals.priceMin())
            .addValue("priceMax", signals.priceMax())
            .addValue("policyTextFound", signals.policyTextFound())
            .addValue("policyExcerpt", signals.policyExcerpt())
            .addValue("privateLabelRatio", signals.privateLabelRatio())
            .addValue("siteExcerpt", signals.siteExcerpt())
            .addValue("brandList", jsonColumns.write(signals.brandList()))
            .addValue("priceTier", signals.priceTier())
            .addValue("scaleScore", signals.scaleScore())
            .addValue("mapBehaviorScore", signals.mapBehaviorScore())
            .addValue("storeCount", signals.storeCount())
            .addValue("artifactPath", signals.artifactPath())
            .addValue("artifactHash", signals.artifactHash())
            .addValue("researchSucceeded", signals.researchSucceeded())
            .addValue("researchError", signals.researchError())
            .addValue("classifiedAt", toTimestamp(signals.classifiedAt()))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<SignalSet> findByLeadId(UUID leadId) {
    final String sql =
        """
        SELECT lead_id, platform, categories::text AS categories_text,
               sample_items::text AS sample_items_text, brand_mentions::text AS brand_mentions_text,
               sku_estimate, price_min, price_max, policy_text_found, policy_excerpt,
               private_label_ratio, site_excerpt, brand_list::text AS brand_list_text, price_tier,
               scale_score, map_behavior_score, store_count, artifact_path, artifact_hash,
               research_succeeded, research_error, classified_at
        FROM lead_signals
        WHERE lead_id = :leadId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("leadId", leadId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private SignalSet mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SignalSet(
        UUID.fromString(rs.getString("lead_id")),
        rs.getString("platform"),
        jsonColumns.readStrings(rs.getString("categories_text")),
        jsonColumns.readStrings(rs.getString("sample_items_text")),
        jsonColumns.readStrings(rs.getString("brand_mentions_text")),
        rs.getObject("sku_estimate", Integer.class),
        rs.getObject("price_min", Double.class),
        rs.getObject("price_max", Double.class),
        rs.getBoolean("policy_text_found"),
        rs.getString("policy_excerpt"),
        rs.getDouble("private_label_ratio"),
        rs.getString("site_excerpt"),
        jsonColumns.readStrings(rs.getString("brand_list_text")),
        rs.getString("price_tier"),
        rs.getInt("scale_score"),
        rs.getInt("map_behavior_score"),
        rs.getInt("store_count"),
        rs.getString("artifact_path"),
        rs.getString("artifact_hash"),
        rs.getBoolean("research_succeeded"),
        rs.getString("research_error"),
        toInstant(rs.getTimestamp("classified_at")));
  }
}
