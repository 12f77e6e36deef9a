/*
 * どこで: Pipeline 管理 API
 * 何を: queue の参照・操作と定期タスクの操作
 * なぜ: 再デプロイなしで失敗 job の再実行や一時停止を行えるようにするため
 */
package com.example.pipeline.api;

import com.example.pipeline.queue.Job;
import com.example.pipeline.queue.JobQueue;
import com.example.pipeline.queue.QueueStats;
import com.example.pipeline.scheduler.PipelineScheduler;
import com.example.pipeline.scheduler.RunResult;
import com.example.pipeline.scheduler.ScheduledTask;
import com.example.pipeline.scheduler.UnknownTaskException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/pipeline")
@RequiredArgsConstructor
@Validated
public class PipelineAdminController {

  private final JobQueue jobQueue;
  private final PipelineScheduler scheduler;
  private final ObjectMapper objectMapper;

  @GetMapping("/queues")
  public Map<String, QueueStats> stats() {
    return jobQueue.getStats();
  }

  @GetMapping("/queues/{queue}")
  public QueueStats queueStats(@PathVariable("queue") String queue) {
    return jobQueue.getStats(queue);
  }

  @GetMapping("/queues/{queue}/failed")
  public FailedJobsResponse failedJobs(
      @PathVariable("queue") String queue,
      @RequestParam(name = "limit", defaultValue = "50")
          @Min(value = 1, message = "limit must be at least 1")
          @Max(value = 500, message = "limit must be at most 500")
          int limit) {
    final List<JobView> jobs =
        jobQueue.getFailedJobs(queue, limit).stream().map(this::toView).toList();
    return new FailedJobsResponse(queue, jobs);
  }

  @GetMapping("/queues/{queue}/jobs/{jobId}")
  public JobView job(@PathVariable("queue") String queue, @PathVariable("jobId") UUID jobId) {
    return toView(jobQueue.getJob(queue, jobId));
  }

  @PostMapping("/queues/{queue}/jobs/{jobId}/retry")
  public JobView retry(@PathVariable("queue") String queue, @PathVariable("jobId") UUID jobId) {
    return toView(jobQueue.retryJob(queue, jobId));
  }

  @PostMapping("/queues/{queue}/pause")
  public QueueActionResponse pause(@PathVariable("queue") String queue) {
    jobQueue.pause(queue);
    return new QueueActionResponse(queue, "pause", 0);
  }

  @PostMapping("/queues/{queue}/resume")
  public QueueActionResponse resume(@PathVariable("queue") String queue) {
    jobQueue.resume(queue);
    return new QueueActionResponse(queue, "resume", 0);
  }

  @PostMapping("/queues/{queue}/drain")
  public QueueActionResponse drain(@PathVariable("queue") String queue) {
    return new QueueActionResponse(queue, "drain", jobQueue.drain(queue));
  }

  @PostMapping("/queues/{queue}/clean")
  public QueueActionResponse clean(
      @PathVariable("queue") String queue,
      @RequestParam(name = "grace-seconds", defaultValue = "0")
          @Min(value = 0, message = "grace-seconds must not be negative")
          long graceSeconds) {
    final int removed = jobQueue.cleanCompleted(queue, Duration.ofSeconds(graceSeconds));
    return new QueueActionResponse(queue, "clean", removed);
  }

  @GetMapping("/tasks")
  public List<ScheduledTask> tasks() {
    return scheduler.tasks();
  }

  @GetMapping("/tasks/status")
  public Map<String, Boolean> taskStatus() {
    return scheduler.status();
  }

  @PostMapping("/tasks/{name}/run")
  public TaskActionResponse run(@PathVariable("name") String name) {
    final RunResult result = scheduler.runNow(name);
    return new TaskActionResponse(name, "run", result.name());
  }

  @PostMapping("/tasks/{name}/start")
  public TaskActionResponse start(@PathVariable("name") String name) {
    if (!scheduler.start(name)) {
      throw new UnknownTaskException(name);
    }
    return new TaskActionResponse(name, "start", "STARTED");
  }

  @PostMapping("/tasks/{name}/stop")
  public TaskActionResponse stop(@PathVariable("name") String name) {
    if (!scheduler.stop(name)) {
      throw new UnknownTaskException(name);
    }
    return new TaskActionResponse(name, "stop", "STOPPED");
  }

  @PostMapping("/tasks/start-all")
  public Map<String, Boolean> startAll() {
    scheduler.startAll();
    return scheduler.status();
  }

  @PostMapping("/tasks/stop-all")
  public Map<String, Boolean> stopAll() {
    scheduler.stopAll();
    return scheduler.status();
  }

  private JobView toView(Job job) {
    return new JobView(
        job.jobId(),
        job.queueName(),
        job.jobType(),
        job.status(),
        job.attemptsMade(),
        job.attemptsMax(),
        job.backoff().type(),
        job.backoff().delay().toMillis(),
        job.priority(),
        job.progress(),
        job.delayUntil(),
        job.lastError(),
        readJson(job.payloadJson()),
        readJson(job.resultJson()),
        job.createdAt(),
        job.finishedAt());
  }

  private JsonNode readJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      return TextNode.valueOf(json);
    }
  }
}
