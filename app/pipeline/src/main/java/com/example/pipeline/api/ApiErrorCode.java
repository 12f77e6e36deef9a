/*
 * どこで: Pipeline API
 * 何を: 全エラーレスポンスに載せるエラーコード
 * なぜ: どちらも 404 でも、クライアントが job 不在と queue 不在を区別できるようにするため
 */
package com.example.pipeline.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  JOB_NOT_FOUND,
  QUEUE_NOT_FOUND,
  TASK_NOT_FOUND,
  ENTITY_NOT_FOUND,
  TASK_ALREADY_REGISTERED,
  JOB_STATE_CONFLICT,
  QUEUE_UNAVAILABLE
}
