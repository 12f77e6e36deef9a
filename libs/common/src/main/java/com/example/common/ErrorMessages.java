/*
 * どこで: 共通ユーティリティ
 * 何を: 例外メッセージを保存前に正規化する
 * なぜ: エラーカラムには長さ上限があり、null メッセージでも読めるようにするため
 */
package com.example.common;

public final class ErrorMessages {

  public static final String UNKNOWN_ERROR = "unknown error";

  private ErrorMessages() {}

  public static String truncate(String message, int maxLength) {
    if (message == null || message.isBlank()) {
      return UNKNOWN_ERROR;
    }
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  public static String describe(Throwable ex, int maxLength) {
    if (ex == null) {
      return UNKNOWN_ERROR;
    }
    final String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return truncate(ex.getClass().getSimpleName(), maxLength);
    }
    return truncate(message, maxLength);
  }
}
