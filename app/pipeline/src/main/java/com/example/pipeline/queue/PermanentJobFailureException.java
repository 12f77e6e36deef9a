/*
 * どこで: Job queue
 * 何を: retry しても直らない失敗を表す
 * なぜ: 不正な宛先や壊れた payload で retry 回数を消費しないため
 */
package com.example.pipeline.queue;

public class PermanentJobFailureException extends RuntimeException {

  public PermanentJobFailureException(String message) {
    super(message);
  }

  public PermanentJobFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
