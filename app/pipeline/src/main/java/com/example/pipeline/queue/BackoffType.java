package com.example.pipeline.queue;

public enum BackoffType {
  FIXED,
  EXPONENTIAL
}
