/*
 * どこで: Lead Engine データアクセス
 * 何を: leverage_rules の読み出しと参照データ投入を担う
 * なぜ: ルール評価の入力を優先度順で安定して取得するため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.ItemSelectionQuery;
import com.example.leadengine.model.LeverageRule;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LeverageRuleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  public List<LeverageRule> findActiveOrdered() {
    final String sql =
        """
        SELECT rule_id, priority, active, channel_match, min_scale_score, max_private_label_ratio,
               min_map_behavior, min_store_count, requires_brand_overlap, requires_adjacent_brands,
               primary_angle, secondary_angle, selection_query::text AS selection_query_text, description
        FROM leverage_rules
        WHERE active = TRUE
        ORDER BY priority, rule_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public long insert(LeverageRule rule, Instant now) {
    final String sql =
        """
        INSERT INTO leverage_rules (
          priority, active, channel_match, min_scale_score, max_private_label_ratio,
          min_map_behavior, min_store_count, requires_brand_overlap, requires_adjacent_brands,
          primary_angle, secondary_angle, selection_query, description, created_at
        ) VALUES (
          :priority, :active, :channelMatch, :minScaleScore, :maxPrivateLabelRatio,
          :minMapBehavior, :minStoreCount, :requiresBrandOverlap, :requiresAdjacentBrands,
          :primaryAngle, :secondaryAngle, :selectionQuery::jsonb, :description, :createdAt
        )
        RETURNING rule_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("priority", rule.priority())
            .addValue("active", rule.active())
            .addValue("channelMatch", rule.channelMatch())
            .addValue("minScaleScore", rule.minScaleScore())
            .addValue("maxPrivateLabelRatio", rule.maxPrivateLabelRatio())
            .addValue("minMapBehavior", rule.minMapBehavior())
            .addValue("minStoreCount", rule.minStoreCount())
            .addValue("requiresBrandOverlap", rule.requiresBrandOverlap())
            .addValue("requiresAdjacentBrands", rule.requiresAdjacentBrands())
            .addValue("primaryAngle", rule.primaryAngle())
            .addValue("secondaryAngle", rule.secondaryAngle())
            .addValue(
                "selectionQuery",
                rule.selectionQuery() == null ? null : jsonColumns.write(rule.selectionQuery()))
            .addValue("description", rule.description())
            .addValue("createdAt", toTimestamp(now));
    final Long ruleId = jdbcTemplate.queryForObject(sql, params, Long.class);
    return ruleId == null ? 0L : ruleId;
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM leverage_rules", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private LeverageRule mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LeverageRule(
        rs.getLong("rule_id"),
        rs.getInt("priority"),
        rs.getBoolean("active"),
        rs.getString("channel_match"),
        rs.getObject("min_scale_score", Integer.class),
        rs.getObject("max_private_label_ratio", Double.class),
        rs.getObject("min_map_behavior", Integer.class),
        rs.getObject("min_store_count", Integer.class),
        rs.getBoolean("requires_brand_overlap"),
        rs.getBoolean("requires_adjacent_brands"),
        rs.getString("primary_angle"),
        rs.getString("secondary_angle"),
        jsonColumns.read(rs.getString("selection_query_text"), ItemSelectionQuery.class),
        rs.getString("description"));
  }
}
