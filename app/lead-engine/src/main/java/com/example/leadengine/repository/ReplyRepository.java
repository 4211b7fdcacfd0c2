/*
 * どこで: Lead Engine データアクセス
 * 何を: replies と承認カウンタの読み書きを担う
 * なぜ: 返信の分類結果と下書きの承認状態を 1 行で追跡するため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.ApprovalState;
import com.example.leadengine.model.Reply;
import com.example.leadengine.model.ReplyAction;
import com.example.leadengine.model.ReplyClassification;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReplyRepository {

  private static final String COLUMNS =
      """
      reply_id, lead_id, outbound_message_id, raw_text, provider_message_id, classification,
      objection_type, action, interest_level, draft_subject, draft_response, approval,
      decided_by, decided_at, response_sent, classifier_call_id, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(Reply reply) {
    final String sql =
        """
        INSERT INTO replies (
          reply_id, lead_id, outbound_message_id, raw_text, provider_message_id, response_sent,
          created_at
        ) VALUES (
          :replyId, :leadId, :outboundMessageId, :rawText, :providerMessageId, FALSE, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("replyId", reply.replyId())
            .addValue("leadId", reply.leadId())
            .addValue("outboundMessageId", reply.outboundMessageId())
            .addValue("rawText", reply.rawText())
            .addValue("providerMessageId", reply.providerMessageId())
            .addValue("createdAt", toTimestamp(reply.createdAt()));
    jdbcTemplate.update(sql, params);
    return reply.replyId();
  }

  public Optional<Reply> findById(UUID replyId) {
    final String sql = "SELECT " + COLUMNS + " FROM replies WHERE reply_id = :replyId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("replyId", replyId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<Reply> findByLeadId(UUID leadId) {
    final String sql = "SELECT " + COLUMNS + " FROM replies WHERE lead_id = :leadId ORDER BY created_at";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("leadId", leadId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<Reply> findPending(int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM replies WHERE approval = 'PENDING' ORDER BY created_at LIMIT :limit";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("limit", limit), this::mapRow);
  }

  /**
   * 分類結果と下書きを反映する。下書きが無い場合は approval を null のまま残す。
   */
  public int updateClassification(
      UUID replyId,
      ReplyClassification classification,
      String objectionType,
      ReplyAction action,
      Integer interestLevel,
      String draftSubject,
      String draftResponse,
      ApprovalState approval,
      String classifierCallId) {
    final String sql =
        """
        UPDATE replies
        SET classification = :classification,
            objection_type = :objectionType,
            action = :action,
            interest_level = :interestLevel,
            draft_subject = :draftSubject,
            draft_response = :draftResponse,
            approval = :approval,
            classifier_call_id = :classifierCallId
        WHERE reply_id = :replyId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("classification", classification.value())
            .addValue("objectionType", objectionType)
            .addValue("action", action.value())
            .addValue("interestLevel", interestLevel)
            .addValue("draftSubject", draftSubject)
            .addValue("draftResponse", draftResponse)
            .addValue("approval", approval == null ? null : approval.name())
            .addValue("classifierCallId", classifierCallId)
            .addValue("replyId", replyId);
    return jdbcTemplate.update(sql, params);
  }

  /** システム全体の下書き数を 1 進め、更新後の値を返す。行ロックで直列化される。 */
  public long incrementDraftCounter() {
    final String sql =
        """
        UPDATE reply_draft_counter
        SET drafted = drafted + 1
        WHERE counter_id = 1
        RETURNING drafted
        """;
    final Long drafted =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return drafted == null ? 0L : drafted;
  }

  /** PENDING のときだけ承認/却下を確定する。 */
  public int decide(UUID replyId, ApprovalState decision, String decidedBy, Instant now) {
    final String sql =
        """
        UPDATE replies
        SET approval = :decision,
            decided_by = :decidedBy,
            decided_at = :now
        WHERE reply_id = :replyId
          AND approval = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("decision", decision.name())
            .addValue("decidedBy", decidedBy)
            .addValue("now", toTimestamp(now))
            .addValue("replyId", replyId);
    return jdbcTemplate.update(sql, params);
  }

  public int markResponseSent(UUID replyId) {
    final String sql =
        """
        UPDATE replies
        SET response_sent = TRUE
        WHERE reply_id = :replyId
          AND approval = 'APPROVED'
          AND response_sent = FALSE
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("replyId", replyId));
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM replies", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public Map<String, Integer> countByClassification() {
    final String sql =
        """
        SELECT COALESCE(classification, 'unclassified') AS classification, COUNT(*) AS total
        FROM replies
        GROUP BY COALESCE(classification, 'unclassified')
        """;
    final Map<String, Integer> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(rs.getString("classification"), rs.getInt("total"));
        });
    return counts;
  }

  private Reply mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String outboundMessageId = rs.getString("outbound_message_id");
    final String classification = rs.getString("classification");
    final String action = rs.getString("action");
    final String approval = rs.getString("approval");
    return new Reply(
        UUID.fromString(rs.getString("reply_id")),
        UUID.fromString(rs.getString("lead_id")),
        outboundMessageId == null ? null : UUID.fromString(outboundMessageId),
        rs.getString("raw_text"),
        rs.getString("provider_message_id"),
        classification == null ? null : ReplyClassification.fromValue(classification),
        rs.getString("objection_type"),
        action == null ? null : ReplyAction.fromValue(action),
        rs.getObject("interest_level", Integer.class),
        rs.getString("draft_subject"),
        rs.getString("draft_response"),
        approval == null ? null : ApprovalState.valueOf(approval),
        rs.getString("decided_by"),
        toInstant(rs.getTimestamp("decided_at")),
        rs.getBoolean("response_sent"),
        rs.getString("classifier_call_id"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
