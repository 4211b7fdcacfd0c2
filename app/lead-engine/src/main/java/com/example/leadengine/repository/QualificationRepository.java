package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.QualificationRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class QualificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int upsert(QualificationRecord record) {
    final String sql =
        """
        INSERT INTO lead_qualifications (
          lead_id, qualified, disqualify_reason, classifier_call_id, schema_version, evaluated_at
        ) VALUES (
          :leadId, :qualified, :disqualifyReason, :classifierCallId, :schemaVersion, :evaluatedAt
        )
        ON CONFLICT (lead_id) DO UPDATE SET
          qualified = EXCLUDED.qualified,
          disqualify_reason = EXCLUDED.disqualify_reason,
          classifier_call_id = EXCLUDED.classifier_call_id,
          schema_version = EXCLUDED.schema_version,
          evaluated_at = EXCLUDED.evaluated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leadId", record.leadId())
            .addValue("qualified", record.qualified())
            .addValue("disqualifyReason", record.disqualifyReason())
            .addValue("classifierCallId", record.classifierCallId())
            .addValue("schemaVersion", record.schemaVersion())
            .addValue("evaluatedAt", toTimestamp(record.evaluatedAt()));
    return jdbcTemplate.update(sql, params);
  }
}
