/*
 * どこで: Lead Engine データアクセス
 * 何を: outbound_messages の登録/一時停止/claim/配信結果の反映を担う
 * なぜ: 送信ワーカーが lease 付きで安全に claim し、返信や抑止で未送信分を止めるため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.OutboundMessageKind;
import com.example.leadengine.model.OutboundMessageStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
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
public class OutboundMessageRepository {

  private static final String COLUMNS =
      """
      message_id, lead_id, sequence_id, touch_index, kind, reply_id, to_address, subject, body,
      status, scheduled_at, sent_at, error, lint_violations::text AS lint_violations_text,
      provider, provider_campaign_ref, provider_message_id, locked_by, lease_until, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(OutboundMessage message, Instant now) {
    final String sql =
        """
        INSERT INTO outbound_messages (
          message_id, lead_id, sequence_id, touch_index, kind, reply_id, to_address, subject, body,
          status, scheduled_at, sent_at, error, lint_violations, provider, provider_campaign_ref,
          provider_message_id, locked_by, lease_until, created_at, updated_at
        ) VALUES (
          :messageId, :leadId, :sequenceId, :touchIndex, :kind, :replyId, :toAddress, :subject, :body,
          :status, :scheduledAt, :sentAt, :error, :lintViolations::jsonb, :provider, :providerCampaignRef,
          :providerMessageId, :lockedBy, :leaseUntil, :createdAt, :now
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("messageId", message.messageId())
            .addValue("leadId", message.leadId())
            .addValue("sequenceId", message.sequenceId())
            .addValue("touchIndex", message.touchIndex())
            .addValue("kind", message.kind().name())
            .addValue("replyId", message.replyId())
            .addValue("toAddress", message.toAddress())
            .addValue("subject", message.subject())
            .addValue("body", message.body())
            .addValue("status", message.status().name())
            .addValue("scheduledAt", toTimestamp(message.scheduledAt()))
            .addValue("sentAt", toTimestamp(message.sentAt()))
            .addValue("error", message.error())
            .addValue(
                "lintViolations",
                message.lintViolationsJson() == null ? "[]" : message.lintViolationsJson())
            .addValue("provider", message.provider())
            .addValue("providerCampaignRef", message.providerCampaignRef())
            .addValue("providerMessageId", message.providerMessageId())
            .addValue("lockedBy", message.lockedBy())
            .addValue("leaseUntil", toTimestamp(message.leaseUntil()))
            .addValue("createdAt", toTimestamp(message.createdAt()))
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
    return message.messageId();
  }

  public Optional<OutboundMessage> findById(UUID messageId) {
    final String sql = "SELECT " + COLUMNS + " FROM outbound_messages WHERE message_id = :messageId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("messageId", messageId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<OutboundMessage> findByLeadId(UUID leadId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM outbound_messages WHERE lead_id = :leadId ORDER BY scheduled_at, touch_index";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("leadId", leadId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<OutboundMessage> findByProviderMessageId(String providerMessageId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM outbound_messages
            WHERE provider_message_id = :providerMessageId
            ORDER BY created_at DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("providerMessageId", providerMessageId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 送信済みで宛先が一致する最新のメッセージ。プロバイダ ID が無いイベントの突合に使う。 */
  public Optional<OutboundMessage> findLatestSentToAddress(String address) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM outbound_messages
            WHERE lower(to_address) = :address
              AND status IN ('SENT', 'DELIVERED')
            ORDER BY sent_at DESC NULLS LAST
            LIMIT 1
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("address", address);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 失敗メッセージのオペレータ確認キュー。 */
  public List<OutboundMessage> findFailed(int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM outbound_messages WHERE status = 'FAILED' ORDER BY created_at DESC LIMIT :limit";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("limit", limit), this::mapRow);
  }

  /**
   * 指定リードの未送信シーケンスを PAUSED にする。返信メッセージは対象外。
   * lease 切れで再 claim を待つ SENDING も止める。
   */
  public int pauseActiveSequence(Collection<UUID> leadIds, Instant now) {
    if (leadIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE outbound_messages
        SET status = 'PAUSED',
            updated_at = :now
        WHERE lead_id IN (:leadIds)
          AND kind = 'SEQUENCE'
          AND (
            status IN (:pausable)
            OR (status = 'SENDING' AND (lease_until IS NULL OR lease_until <= :now))
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leadIds", leadIds)
            .addValue(
                "pausable", OutboundMessageStatus.pausable().stream().map(Enum::name).toList());
    return jdbcTemplate.update(sql, params);
  }

  public List<OutboundMessage> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 送信予定時刻を過ぎた RENDERED と lease 切れの SENDING をまとめて claim する
    final String sql =
        """
        WITH cte AS (
          SELECT message_id
          FROM outbound_messages
          WHERE (
            status = 'RENDERED'
            AND scheduled_at <= :now
          )
          OR (
            status = 'SENDING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY scheduled_at, touch_index
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE outbound_messages m
        SET status = 'SENDING',
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE m.message_id = cte.message_id
        RETURNING m.message_id, m.lead_id, m.sequence_id, m.touch_index, m.kind, m.reply_id,
                  m.to_address, m.subject, m.body, m.status, m.scheduled_at, m.sent_at, m.error,
                  m.lint_violations::text AS lint_violations_text, m.provider,
                  m.provider_campaign_ref, m.provider_message_id, m.locked_by, m.lease_until,
                  m.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(
      UUID messageId,
      String provider,
      String campaignRef,
      String providerMessageId,
      Instant sentAt,
      String lockedBy) {
    final String sql =
        """
        UPDATE outbound_messages
        SET status = 'SENT',
            sent_at = :sentAt,
            provider = :provider,
            provider_campaign_ref = :campaignRef,
            provider_message_id = :providerMessageId,
            error = NULL,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :sentAt
        WHERE message_id = :messageId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("provider", provider)
            .addValue("campaignRef", campaignRef)
            .addValue("providerMessageId", providerMessageId)
            .addValue("messageId", messageId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** claim 中のメッセージを PAUSED か FAILED に落とす。 */
  public int release(
      UUID messageId, OutboundMessageStatus status, String error, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE outbound_messages
        SET status = :status,
            error = :error,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE message_id = :messageId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("messageId", messageId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markDelivered(UUID messageId, Instant now) {
    final String sql =
        """
        UPDATE outbound_messages
        SET status = 'DELIVERED',
            updated_at = :now
        WHERE message_id = :messageId
          AND status = 'SENT'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("messageId", messageId);
    return jdbcTemplate.update(sql, params);
  }

  public int markBounced(UUID messageId, String error, Instant now) {
    final String sql =
        """
        UPDATE outbound_messages
        SET status = 'BOUNCED',
            error = :error,
            updated_at = :now
        WHERE message_id = :messageId
          AND status IN ('SENT', 'DELIVERED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("messageId", messageId);
    return jdbcTemplate.update(sql, params);
  }

  public Map<String, Integer> countByStatus() {
    final String sql = "SELECT status, COUNT(*) AS total FROM outbound_messages GROUP BY status";
    final Map<String, Integer> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(rs.getString("status"), rs.getInt("total"));
        });
    return counts;
  }

  private OutboundMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String sequenceId = rs.getString("sequence_id");
    final String replyId = rs.getString("reply_id");
    return new OutboundMessage(
        UUID.fromString(rs.getString("message_id")),
        UUID.fromString(rs.getString("lead_id")),
        sequenceId == null ? null : UUID.fromString(sequenceId),
        rs.getInt("touch_index"),
        OutboundMessageKind.valueOf(rs.getString("kind")),
        replyId == null ? null : UUID.fromString(replyId),
        rs.getString("to_address"),
        rs.getString("subject"),
        rs.getString("body"),
        OutboundMessageStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("scheduled_at")),
        toInstant(rs.getTimestamp("sent_at")),
        rs.getString("error"),
        rs.getString("lint_violations_text"),
        rs.getString("provider"),
        rs.getString("provider_campaign_ref"),
        rs.getString("provider_message_id"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
