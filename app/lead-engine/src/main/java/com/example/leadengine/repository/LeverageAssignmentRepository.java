package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.ItemSelectionQuery;
import com.example.leadengine.model.LeverageAssignment;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LeverageAssignmentRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  // 再評価時は同じ行を上書きする
  public int upsert(LeverageAssignment assignment) {
    final String sql =
        """
        INSERT INTO lead_leverage (
          lead_id, matched_rule_id, primary_angle, secondary_angle, match_reason, fallback,
          selection_query, selected_item_ids, assigned_at
        ) VALUES (
          :leadId, :matchedRuleId, :primaryAngle, :secondaryAngle, :matchReason, :fallback,
          :selectionQuery::jsonb, :selectedItemIds::jsonb, :assignedAt
        )
        ON CONFLICT (lead_id) DO UPDATE SET
          matched_rule_id = EXCLUDED.matched_rule_id,
          primary_angle = EXCLUDED.primary_angle,
          secondary_angle = EXCLUDED.secondary_angle,
          match_reason = EXCLUDED.match_reason,
          fallback = EXCLUDED.fallback,
          selection_query = EXCLUDED.selection_query,
          selected_item_ids = EXCLUDED.selected_item_ids,
          assigned_at = EXCLUDED.assigned_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leadId", assignment.leadId())
            .addValue("matchedRuleId", assignment.matchedRuleId())
            .addValue("primaryAngle", assignment.primaryAngle())
            .addValue("secondaryAngle", assignment.secondaryAngle())
            .addValue("matchReason", assignment.matchReason())
            .addValue("fallback", assignment.fallback())
            .addValue("selectionQuery", jsonColumns.write(assignment.selectionQuery()))
            .addValue("selectedItemIds", jsonColumns.write(assignment.selectedItemIds()))
            .addValue("assignedAt", toTimestamp(assignment.assignedAt()));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<LeverageAssignment> findByLeadId(UUID leadId) {
    final String sql =
        """
        SELECT lead_id, matched_rule_id, primary_angle, secondary_angle, match_reason, fallback,
               selection_query::text AS selection_query_text,
               selected_item_ids::text AS selected_item_ids_text, assigned_at
        FROM lead_leverage
        WHERE lead_id = :leadId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("leadId", leadId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private LeverageAssignment mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LeverageAssignment(
        UUID.fromString(rs.getString("lead_id")),
        rs.getObject("matched_rule_id", Long.class),
        rs.getString("primary_angle"),
        rs.getString("secondary_angle"),
        rs.getString("match_reason"),
        rs.getBoolean("fallback"),
        jsonColumns.read(rs.getString("selection_query_text"), ItemSelectionQuery.class),
        jsonColumns.readLongs(rs.getString("selected_item_ids_text")),
        toInstant(rs.getTimestamp("assigned_at")));
  }
}
