/*
 * どこで: 配信チャネルのモデル
 * 何を: プロバイダへ渡せる状態のレンダリング済みメール
 * なぜ: job payload と直接経路で同じ値を使うため
 */
package com.example.pipeline.channel;

import java.util.List;

public record EmailMessage(
    String to, String subject, String text, String html, List<EmailAttachment> attachments) {

  public EmailMessage {
    // 前提: 添付なしで書かれた payload は null としてデシリアライズされる
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  public static EmailMessage of(String to, String subject, String text, String html) {
    return new EmailMessage(to, subject, text, html, List.of());
  }

  public boolean hasValidRecipient() {
    if (to == null) {
      return false;
    }
    final int at = to.indexOf('@');
    return at > 0 && at < to.length() - 1 && to.indexOf('@', at + 1) < 0;
  }
}
