/*
 * どこで: Job queue のポート
 * 何を: 1 つの queue 上の 1 job 種別を処理するハンドラ
 */
package com.example.pipeline.queue;

/**
 * Runs a job.
 *
 * <p>Returning normally completes the job; the returned value, when not null, is stored as the
 * job result. Throwing schedules a retry with the job's backoff while attempts remain. Throw
 * {@link PermanentJobFailureException} to fail the job at once.
 */
@FunctionalInterface
public interface JobProcessor {

  Object process(JobContext context) throws Exception;
}
