/*
 * どこで: Lead Engine データアクセス
 * 何を: suppression_entries の登録と照会を担う
 * なぜ: 一度登録した抑止を削除経路なしで永続化し、送信前に照会するため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.SuppressionEntry;
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
public class SuppressionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 既に登録済みのアドレスなら 0 を返す。 */
  public int insertAddress(
      String address, String domain, String reason, UUID sourceLeadId, Instant now) {
    final String sql =
        """
        INSERT INTO suppression_entries (address, domain, reason, source_lead_id, created_at)
        VALUES (:address, :domain, :reason, :sourceLeadId, :now)
        ON CONFLICT (address) WHERE address IS NOT NULL DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("address", address)
            .addValue("domain", domain)
            .addValue("reason", reason)
            .addValue("sourceLeadId", sourceLeadId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** ドメイン単位の抑止。既に登録済みなら 0 を返す。 */
  public int insertDomain(String domain, String reason, UUID sourceLeadId, Instant now) {
    final String sql =
        """
        INSERT INTO suppression_entries (address, domain, reason, source_lead_id, created_at)
        VALUES (NULL, :domain, :reason, :sourceLeadId, :now)
        ON CONFLICT (domain) WHERE address IS NULL DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("reason", reason)
            .addValue("sourceLeadId", sourceLeadId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** アドレス一致、またはドメイン単位の抑止に該当すれば true。 */
  public boolean isSuppressed(String address, String domain) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM suppression_entries
          WHERE address = :address
             OR (address IS NULL AND domain = :domain)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("address", address).addValue("domain", domain);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public List<SuppressionEntry> findRecent(int limit) {
    final String sql =
        """
        SELECT suppression_id, address, domain, reason, source_lead_id, created_at
        FROM suppression_entries
        ORDER BY created_at DESC, suppression_id DESC
        LIMIT :limit
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("limit", limit), this::mapRow);
  }

  private SuppressionEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String sourceLeadId = rs.getString("source_lead_id");
    return new SuppressionEntry(
        rs.getLong("suppression_id"),
        rs.getString("address"),
        rs.getString("domain"),
        rs.getString("reason"),
        sourceLeadId == null ? null : UUID.fromString(sourceLeadId),
        toInstant(rs.getTimestamp("created_at")));
  }
}
