/*
 * どこで: Lead Engine データアクセス
 * 何を: audit_log への追記と照会を担う
 * なぜ: 状態変更と同じトランザクションで因果の記録を残すため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.AuditEntry;
import com.example.leadengine.model.AuditEvent;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditLogRepository {

  private static final String COLUMNS =
      """
      audit_id, correlation_id, event, lead_id, job_id, actor, payload::text AS payload_text,
      created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // 追記のみ。更新/削除のメソッドは持たない
  public long insert(
      String correlationId,
      AuditEvent event,
      UUID leadId,
      UUID jobId,
      String actor,
      String payloadJson,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO audit_log (correlation_id, event, lead_id, job_id, actor, payload, created_at)
        VALUES (:correlationId, :event, :leadId, :jobId, :actor, :payload::jsonb, :createdAt)
        RETURNING audit_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("correlationId", correlationId)
            .addValue("event", event.value())
            .addValue("leadId", leadId)
            .addValue("jobId", jobId)
            .addValue("actor", actor)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    final Long auditId = jdbcTemplate.queryForObject(sql, params, Long.class);
    return auditId == null ? 0L : auditId;
  }

  public List<AuditEntry> findRecent(int limit) {
    final String sql =
        "SELECT " + COLUMNS + " FROM audit_log ORDER BY audit_id DESC LIMIT :limit";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("limit", limit), this::mapRow);
  }

  /** リード単位の履歴。古い順に返す。 */
  public List<AuditEntry> findByLeadId(UUID leadId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM audit_log WHERE lead_id = :leadId ORDER BY audit_id LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("leadId", leadId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByEvent(AuditEvent event) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM audit_log WHERE event = :event",
            new MapSqlParameterSource().addValue("event", event.value()),
            Integer.class);
    return count == null ? 0 : count;
  }

  private AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String leadId = rs.getString("lead_id");
    final String jobId = rs.getString("job_id");
    return new AuditEntry(
        rs.getLong("audit_id"),
        rs.getString("correlation_id"),
        AuditEvent.fromValue(rs.getString("event")),
        leadId == null ? null : UUID.fromString(leadId),
        jobId == null ? null : UUID.fromString(jobId),
        rs.getString("actor"),
        rs.getString("payload_text"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
