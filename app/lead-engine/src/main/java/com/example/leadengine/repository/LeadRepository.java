/*
 * どこで: Lead Engine データアクセス
 * 何を: leads テーブルの登録/取得/条件付き状態更新を担う
 * なぜ: 状態遷移を許可された遷移元に限定した UPDATE で守るため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadOutcome;
import com.example.leadengine.model.LeadStatus;
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
public class LeadRepository {

  private static final String COLUMNS =
      """
      lead_id, company_name, website_url, contact_email, channel, niche, location, notes,
      status, disqualify_reason, outcome, outcome_notes, booked_at, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** website_url が既存なら 0 を返し、何も書き込まない。 */
  public int insertIfAbsent(Lead lead) {
    final String sql =
        """
        INSERT INTO leads (
          lead_id, company_name, website_url, contact_email, channel, niche, location, notes,
          status, created_at, updated_at
        ) VALUES (
          :leadId, :companyName, :websiteUrl, :contactEmail, :channel, :niche, :location, :notes,
          :status, :createdAt, :updatedAt
        )
        ON CONFLICT (website_url) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leadId", lead.leadId())
            .addValue("companyName", lead.companyName())
            .addValue("websiteUrl", lead.websiteUrl())
            .addValue("contactEmail", lead.contactEmail())
            .addValue("channel", lead.channel())
            .addValue("niche", lead.niche())
            .addValue("location", lead.location())
            .addValue("notes", lead.notes())
            .addValue("status", lead.status().name())
            .addValue("createdAt", toTimestamp(lead.createdAt()))
            .addValue("updatedAt", toTimestamp(lead.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<Lead> findById(UUID leadId) {
    final String sql = "SELECT " + COLUMNS + " FROM leads WHERE lead_id = :leadId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("leadId", leadId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<Lead> findByWebsite(String websiteUrl) {
    final String sql = "SELECT " + COLUMNS + " FROM leads WHERE website_url = :websiteUrl";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("websiteUrl", websiteUrl);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<Lead> findByContactEmail(String address) {
    final String sql =
        "SELECT " + COLUMNS + " FROM leads WHERE lower(contact_email) = :address ORDER BY created_at";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("address", address);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<Lead> findRecent(int limit) {
    final String sql = "SELECT " + COLUMNS + " FROM leads ORDER BY created_at DESC LIMIT :limit";
    return jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("limit", limit), this::mapRow);
  }

  /**
   * 現在の状態が target の遷移元に含まれる場合のみ更新する。
   * reason が null なら disqualify_reason は変更しない。
   */
  public int transition(UUID leadId, LeadStatus target, String reason, Instant now) {
    final String sql =
        """
        UPDATE leads
        SET status = :target,
            disqualify_reason = COALESCE(:reason, disqualify_reason),
            booked_at = CASE WHEN :target = 'BOOKED' THEN :now ELSE booked_at END,
            updated_at = :now
        WHERE lead_id = :leadId
          AND status IN (:sources)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("target", target.name())
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now))
            .addValue("leadId", leadId)
            .addValue("sources", target.sources().stream().map(Enum::name).toList());
    return jdbcTemplate.update(sql, params);
  }

  /** 連絡先が一致する DEAD 以外のリードをすべて DEAD にし、対象 ID を返す。 */
  public List<UUID> markDeadByAddress(String address, String reason, Instant now) {
    final String sql =
        """
        UPDATE leads
        SET status = 'DEAD',
            disqualify_reason = :reason,
            updated_at = :now
        WHERE lower(contact_email) = :address
          AND status <> 'DEAD'
        RETURNING lead_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("address", address)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("lead_id")));
  }

  public List<UUID> markDeadByDomain(String domain, String reason, Instant now) {
    final String sql =
        """
        UPDATE leads
        SET status = 'DEAD',
            disqualify_reason = :reason,
            updated_at = :now
        WHERE split_part(lower(contact_email), '@', 2) = :domain
          AND status <> 'DEAD'
        RETURNING lead_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("lead_id")));
  }

  public List<UUID> findIdsByContactEmail(String address) {
    final String sql = "SELECT lead_id FROM leads WHERE lower(contact_email) = :address";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("address", address);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("lead_id")));
  }

  public List<UUID> findIdsByContactDomain(String domain) {
    final String sql =
        "SELECT lead_id FROM leads WHERE split_part(lower(contact_email), '@', 2) = :domain";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("domain", domain);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("lead_id")));
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM leads", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int updateOutcome(UUID leadId, LeadOutcome outcome, String notes, Instant now) {
    final String sql =
        """
        UPDATE leads
        SET outcome = :outcome,
            outcome_notes = :notes,
            updated_at = :now
        WHERE lead_id = :leadId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("outcome", outcome.value())
            .addValue("notes", notes)
            .addValue("now", toTimestamp(now))
            .addValue("leadId", leadId);
    return jdbcTemplate.update(sql, params);
  }

  public Map<String, Integer> countByStatus() {
    final String sql = "SELECT status, COUNT(*) AS total FROM leads GROUP BY status";
    final Map<String, Integer> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(rs.getString("status"), rs.getInt("total"));
        });
    return counts;
  }

  private Lead mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String outcome = rs.getString("outcome");
    return new Lead(
        UUID.fromString(rs.getString("lead_id")),
        rs.getString("company_name"),
        rs.getString("website_url"),
        rs.getString("contact_email"),
        rs.getString("channel"),
        rs.getString("niche"),
        rs.getString("location"),
        rs.getString("notes"),
        LeadStatus.valueOf(rs.getString("status")),
        rs.getString("disqualify_reason"),
        outcome == null ? null : LeadOutcome.fromValue(outcome),
        rs.getString("outcome_notes"),
        toInstant(rs.getTimestamp("booked_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
