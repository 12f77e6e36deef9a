package com.example.pipeline.queue;

/** Progress callback handed to processors; values are clamped to 0..100. */
@FunctionalInterface
public interface JobProgress {

  void report(int percent);
}
