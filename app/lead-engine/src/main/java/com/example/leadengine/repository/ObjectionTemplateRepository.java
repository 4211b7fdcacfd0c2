package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.ObjectionTemplate;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ObjectionTemplateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ObjectionTemplate> findActive(String objectionType) {
    final String sql =
        """
        SELECT objection_type, template_subject, template_body, active
        FROM objection_templates
        WHERE objection_type = :objectionType
          AND active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("objectionType", objectionType);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new ObjectionTemplate(
                    rs.getString("objection_type"),
                    rs.getString("template_subject"),
                    rs.getString("template_body"),
                    rs.getBoolean("active")))
        .stream()
        .findFirst();
  }

  public int insertIfAbsent(ObjectionTemplate template, Instant now) {
    final String sql =
        """
        INSERT INTO objection_templates (
          objection_type, template_subject, template_body, active, created_at
        ) VALUES (
          :objectionType, :templateSubject, :templateBody, :active, :createdAt
        )
        ON CONFLICT (objection_type) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("objectionType", template.objectionType())
            .addValue("templateSubject", template.templateSubject())
            .addValue("templateBody", template.templateBody())
            .addValue("active", template.active())
            .addValue("createdAt", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM objection_templates", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
