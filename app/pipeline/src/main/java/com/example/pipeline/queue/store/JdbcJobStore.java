/*
 * どこで: Job queue の永続化
 * 何を: pipeline_job / pipeline_queue_state を使う PostgreSQL の job ストア
 * なぜ: 再起動後も job を残し、複数インスタンスで queue を共有するため
 */
package com.example.pipeline.queue.store;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pipeline.queue.BackoffPolicy;
import com.example.pipeline.queue.BackoffType;
import com.example.pipeline.queue.Job;
import com.example.pipeline.queue.JobStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.queue.store", havingValue = "jdbc")
public class JdbcJobStore implements JobStore {

  private static final String SELECT_COLUMNS =
      """
      job_id, queue_name, job_type, payload_json::text AS payload_json_text,
      attempts_max, attempts_made, backoff_type, backoff_delay_ms, priority,
      remove_on_complete, status, delay_until, progress, last_error,
      result_json::text AS result_json_text, locked_by, lease_until, created_at, finished_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(Job job) {
    final String sql =
        """
        INSERT INTO pipeline_job (
          job_id, queue_name, job_type, payload_json, attempts_max, attempts_made,
          backoff_type, backoff_delay_ms, priority, remove_on_complete, status,
          delay_until, progress, created_at
        ) VALUES (
          :jobId, :queueName, :jobType, CAST(:payloadJson AS jsonb), :attemptsMax, :attemptsMade,
          :backoffType, :backoffDelayMs, :priority, :removeOnComplete, :status,
          :delayUntil, :progress, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("queueName", job.queueName())
            .addValue("jobType", job.jobType())
            .addValue("payloadJson", job.payloadJson())
            .addValue("attemptsMax", job.attemptsMax())
            .addValue("attemptsMade", job.attemptsMade())
            .addValue("backoffType", job.backoff().type().name())
            .addValue("backoffDelayMs", job.backoff().delay().toMillis())
            .addValue("priority", job.priority())
            .addValue("removeOnComplete", job.removeOnComplete())
            .addValue("status", job.status().name())
            .addValue("delayUntil", toTimestamp(job.delayUntil()))
            .addValue("progress", job.progress())
            .addValue("createdAt", toTimestamp(job.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<Job> find(UUID jobId) {
    final String sql = "SELECT " + SELECT_COLUMNS + " FROM pipeline_job WHERE job_id = :jobId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("jobId", jobId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public List<Job> claimReady(
      String queueName, int limit, Instant now, Instant leaseUntil, String lockedBy) {
    if (limit <= 0) {
      return List.of();
    }
    // 前提: 選択と有効化を 1 文で行い、2 インスタンスが同じ job を取得しないようにする
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM pipeline_job
          WHERE queue_name = :queueName
            AND (status = 'WAITING' OR (status = 'DELAYED' AND delay_until <= :now))
          ORDER BY priority DESC, seq
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE pipeline_job j
        SET status = 'ACTIVE',
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            delay_until = NULL
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.queue_name, j.job_type, j.payload_json::text AS payload_json_text,
                  j.attempts_max, j.attempts_made, j.backoff_type, j.backoff_delay_ms, j.priority,
                  j.remove_on_complete, j.status, j.delay_until, j.progress, j.last_error,
                  j.result_json::text AS result_json_text, j.locked_by, j.lease_until,
                  j.created_at, j.finished_at, j.seq
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("now", toTimestamp(now))
            .addValue("limit", limit)
            .addValue("lockedBy", lockedBy)
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    // RETURNING は CTE の順序を保たない
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> new SequencedJob(rs.getLong("seq"), mapRow(rs, rowNum)))
        .stream()
        .sorted(
            Comparator.comparingInt((SequencedJob sequenced) -> sequenced.job().priority())
                .reversed()
                .thenComparingLong(SequencedJob::seq))
        .map(SequencedJob::job)
        .toList();
  }

  @Override
  public int markCompleted(
      UUID jobId, String lockedBy, Instant now, String resultJson, boolean remove) {
    if (remove) {
      final String sql =
          """
          DELETE FROM pipeline_job
          WHERE job_id = :jobId AND status = 'ACTIVE' AND locked_by = :lockedBy
          """;
      return jdbcTemplate.update(
          sql, new MapSqlParameterSource().addValue("jobId", jobId).addValue("lockedBy", lockedBy));
    }
    final String sql =
        """
        UPDATE pipeline_job
        SET status = 'COMPLETED',
            progress = 100,
            result_json = CAST(:resultJson AS jsonb),
            finished_at = :now,
            locked_by = NULL,
            lease_until = NULL
        WHERE job_id = :jobId AND status = 'ACTIVE' AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy)
            .addValue("resultJson", resultJson)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markDelayed(
      UUID jobId, String lockedBy, int attemptsMade, Instant delayUntil, String error) {
    final String sql =
        """
        UPDATE pipeline_job
        SET status = 'DELAYED',
            attempts_made = :attemptsMade,
            delay_until = :delayUntil,
            last_error = :error,
            locked_by = NULL,
            lease_until = NULL
        WHERE job_id = :jobId AND status = 'ACTIVE' AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy)
            .addValue("attemptsMade", attemptsMade)
            .addValue("delayUntil", toTimestamp(delayUntil))
            .addValue("error", error);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markFailed(UUID jobId, String lockedBy, int attemptsMade, Instant now, String error) {
    final String sql =
        """
        UPDATE pipeline_job
        SET status = 'FAILED',
            attempts_made = :attemptsMade,
            last_error = :error,
            finished_at = :now,
            locked_by = NULL,
            lease_until = NULL
        WHERE job_id = :jobId AND status = 'ACTIVE' AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy)
            .addValue("attemptsMade", attemptsMade)
            .addValue("error", error)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public void updateProgress(UUID jobId, int progress) {
    final String sql = "UPDATE pipeline_job SET progress = :progress WHERE job_id = :jobId";
    jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("jobId", jobId).addValue("progress", progress));
  }

  @Override
  public boolean resetFailed(UUID jobId) {
    final String sql =
        """
        UPDATE pipeline_job
        SET status = 'WAITING',
            attempts_made = 0,
            progress = 0,
            result_json = NULL,
            finished_at = NULL
        WHERE job_id = :jobId AND status = 'FAILED'
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("jobId", jobId)) > 0;
  }

  @Override
  public int releaseExpiredLeases(String queueName, Instant now) {
    final String sql =
        """
        UPDATE pipeline_job
        SET status = 'WAITING',
            locked_by = NULL,
            lease_until = NULL
        WHERE queue_name = :queueName
          AND status = 'ACTIVE'
          AND lease_until < :now
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("now", toTimestamp(now)));
  }

  @Override
  public Map<JobStatus, Long> countByStatus(String queueName) {
    final String sql =
        """
        SELECT status, COUNT(*) AS total
        FROM pipeline_job
        WHERE queue_name = :queueName
        GROUP BY status
        """;
    final Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      counts.put(status, 0L);
    }
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("queueName", queueName),
        (RowCallbackHandler)
            rs -> counts.put(JobStatus.valueOf(rs.getString("status")), rs.getLong("total")));
    return counts;
  }

  @Override
  public List<Job> findByStatus(String queueName, JobStatus status, int limit) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM pipeline_job
            WHERE queue_name = :queueName AND status = :status
            ORDER BY seq DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("status", status.name())
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public int deleteWaitingAndDelayed(String queueName) {
    final String sql =
        """
        DELETE FROM pipeline_job
        WHERE queue_name = :queueName AND status IN ('WAITING', 'DELAYED')
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("queueName", queueName));
  }

  @Override
  public int deleteCompletedBefore(String queueName, Instant threshold) {
    final String sql =
        """
        DELETE FROM pipeline_job
        WHERE queue_name = :queueName
          AND status = 'COMPLETED'
          AND finished_at < :threshold
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("threshold", toTimestamp(threshold)));
  }

  @Override
  public void setPaused(String queueName, boolean paused) {
    final String sql =
        """
        INSERT INTO pipeline_queue_state (queue_name, paused, updated_at)
        VALUES (:queueName, :paused, now())
        ON CONFLICT (queue_name) DO UPDATE SET paused = EXCLUDED.paused, updated_at = now()
        """;
    jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("queueName", queueName).addValue("paused", paused));
  }

  @Override
  public boolean isPaused(String queueName) {
    final String sql = "SELECT paused FROM pipeline_queue_state WHERE queue_name = :queueName";
    final List<Boolean> rows =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource("queueName", queueName),
            (rs, rowNum) -> rs.getBoolean("paused"));
    return !rows.isEmpty() && rows.get(0);
  }

  private Job mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Job(
        rs.getObject("job_id", UUID.class),
        rs.getString("queue_name"),
        rs.getString("job_type"),
        rs.getString("payload_json_text"),
        rs.getInt("attempts_max"),
        rs.getInt("attempts_made"),
        new BackoffPolicy(
            BackoffType.valueOf(rs.getString("backoff_type")),
            Duration.ofMillis(rs.getLong("backoff_delay_ms"))),
        rs.getInt("priority"),
        rs.getBoolean("remove_on_complete"),
        JobStatus.valueOf(rs.getString("status")),
        toInstant(rs, "delay_until"),
        rs.getInt("progress"),
        rs.getString("last_error"),
        rs.getString("result_json_text"),
        rs.getString("locked_by"),
        toInstant(rs, "lease_until"),
        toInstant(rs, "created_at"),
        toInstant(rs, "finished_at"));
  }

  private record SequencedJob(long seq, Job job) {}
}
