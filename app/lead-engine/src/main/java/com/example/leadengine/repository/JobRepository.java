/*
 * どこで: Lead Engine データアクセス
 * 何を: jobs テーブルの登録/claim/確定を担う
 * なぜ: 複数ワーカーが同じジョブを二重実行しないよう条件付き UPDATE で claim するため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.Job;
import com.example.leadengine.model.JobStatus;
import com.example.leadengine.model.JobType;
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
public class JobRepository {

  private static final String COLUMNS =
      """
      job_id, job_type, lead_id, status, attempts, locked_by, error,
      created_at, started_at, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(Job job) {
    final String sql =
        """
        INSERT INTO jobs (
          job_id, job_type, lead_id, status, attempts, locked_by, error,
          created_at, started_at, completed_at
        ) VALUES (
          :jobId, :jobType, :leadId, :status, :attempts, :lockedBy, :error,
          :createdAt, :startedAt, :completedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("jobType", job.jobType().name())
            .addValue("leadId", job.leadId())
            .addValue("status", job.status().name())
            .addValue("attempts", job.attempts())
            .addValue("lockedBy", job.lockedBy())
            .addValue("error", job.error())
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("startedAt", toTimestamp(job.startedAt()))
            .addValue("completedAt", toTimestamp(job.completedAt()));
    jdbcTemplate.update(sql, params);
    return job.jobId();
  }

  public Optional<Job> findById(UUID jobId) {
    final String sql = "SELECT " + COLUMNS + " FROM jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<Job> findQueued(JobType jobType, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM jobs
            WHERE status = 'QUEUED'
              AND job_type = :jobType
            ORDER BY created_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobType", jobType.name()).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<Job> findByLeadId(UUID leadId) {
    final String sql = "SELECT " + COLUMNS + " FROM jobs WHERE lead_id = :leadId ORDER BY created_at";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("leadId", leadId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** QUEUED のままなら RUNNING に進めて 1 を返す。他ワーカーが先に取っていれば 0。 */
  public int claim(UUID jobId, String lockedBy, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'RUNNING',
            attempts = attempts + 1,
            locked_by = :lockedBy,
            started_at = :now
        WHERE job_id = :jobId
          AND status = 'QUEUED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now))
            .addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  public int markSuccess(UUID jobId, Instant now) {
    return finish(jobId, JobStatus.SUCCESS, null, now);
  }

  public int markFailed(UUID jobId, String error, Instant now) {
    return finish(jobId, JobStatus.FAILED, error, now);
  }

  public Map<String, Integer> countByStatus() {
    final String sql = "SELECT status, COUNT(*) AS total FROM jobs GROUP BY status";
    final Map<String, Integer> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(rs.getString("status"), rs.getInt("total"));
        });
    return counts;
  }

  private int finish(UUID jobId, JobStatus status, String error, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET status = :status,
            error = :error,
            completed_at = :now
        WHERE job_id = :jobId
          AND status IN ('QUEUED', 'RUNNING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  private Job mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Job(
        UUID.fromString(rs.getString("job_id")),
        JobType.valueOf(rs.getString("job_type")),
        UUID.fromString(rs.getString("lead_id")),
        JobStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getString("locked_by"),
        rs.getString("error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at")));
  }
}
