/*
 * どこで: Job processor
 * 何を: queue 経由の配信について、プロバイダの応答後に notification 行を書く
 * なぜ: email_envoye / sms_envoye を enqueue ではなく実際の送信結果にするため
 */
package com.example.pipeline.queue.processor;

import com.example.pipeline.notification.Notification;
import com.example.pipeline.notification.NotificationRepository;
import com.example.pipeline.notification.PendingNotification;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryHistoryRecorder {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryHistoryRecorder.class);

  private final NotificationRepository notificationRepository;
  private final Clock clock;

  /** Writes one row; a payload without pending content (plain emails) writes nothing. */
  public void record(PendingNotification pending, boolean emailSent, boolean smsSent) {
    if (pending == null) {
      return;
    }
    insert(List.of(pending.toNotification(emailSent, smsSent, Instant.now(clock))));
  }

  public void recordAll(List<Notification> rows) {
    if (rows.isEmpty()) {
      return;
    }
    insert(rows);
  }

  public Instant now() {
    return Instant.now(clock);
  }

  private void insert(List<Notification> rows) {
    try {
      notificationRepository.insertAll(rows);
    } catch (DataAccessException ex) {
      // 前提: 送信は完了済み。ここで job を失敗させると retry で再送される
      logger.error("queued notification history insert failed rows={}", rows.size(), ex);
    }
  }
}
