/*
 * どこで: 通知ディスパッチ
 * 何を: メッセージを job queue に渡す
 * なぜ: 通常経路。retry とプロバイダへのペース配分は queue が担う
 */
package com.example.pipeline.dispatch;

import com.example.pipeline.config.DeliveryProperties;
import com.example.pipeline.notification.NotificationType;
import com.example.pipeline.platform.NotificationCategory;
import com.example.pipeline.queue.BulkEnqueueResult;
import com.example.pipeline.queue.JobHandle;
import com.example.pipeline.queue.JobQueue;
import com.example.pipeline.queue.QueueName;
import com.example.pipeline.queue.processor.BulkEmailJobProcessor;
import com.example.pipeline.queue.processor.BulkEmailPayload;
import com.example.pipeline.queue.processor.BulkRecipient;
import com.example.pipeline.queue.processor.NotificationJobPayload;
import com.example.pipeline.queue.processor.NotificationJobProcessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transactional email-only messages go to the {@code email} queue; everything else to the
 * {@code notification} queue. Jobs carry the notification row and write it after the send, so
 * messages with a channel come back as {@link DeliveryOutcome#queued() queued}. Throws {@link
 * com.example.pipeline.queue.QueueUnavailableException} when the queue cannot take the job.
 */
@Component
@RequiredArgsConstructor
public class QueueBackedDelivery implements DeliveryStrategy {

  private static final Logger logger = LoggerFactory.getLogger(QueueBackedDelivery.class);

  private final JobQueue jobQueue;
  private final DeliveryProperties properties;

  @Override
  public String name() {
    return "queue";
  }

  @Override
  public DeliveryOutcome deliver(OutboundMessage message) {
    if (message.isInAppOnly()) {
      return DeliveryOutcome.inAppOnly();
    }
    final NotificationJobPayload payload =
        new NotificationJobPayload(
            message.userId(),
            message.type().code(),
            message.email(),
            message.hasSms() ? message.smsTo() : null,
            message.hasSms() ? message.smsText() : null,
            message.history());
    final JobHandle handle =
        isTransactionalEmail(message)
            ? jobQueue.enqueue(
                QueueName.EMAIL.id(),
                NotificationJobProcessor.JOB_TYPE,
                payload,
                properties.email().toOptions())
            : jobQueue.enqueue(
                QueueName.NOTIFICATION.id(),
                NotificationJobProcessor.JOB_TYPE,
                payload,
                properties.notification().toOptions());
    logger.debug(
        "notification enqueued userId={} type={} queue={} jobId={}",
        message.userId(),
        message.type().code(),
        handle.queueName(),
        handle.jobId());
    return DeliveryOutcome.queuedForDelivery();
  }

  @Override
  public List<DeliveryOutcome> deliverBulk(String campaign, List<OutboundMessage> messages) {
    final List<BulkRecipient> recipients =
        messages.stream()
            .filter(OutboundMessage::hasEmail)
            .map(message -> new BulkRecipient(message.email(), message.history()))
            .toList();
    if (!recipients.isEmpty()) {
      final BulkEnqueueResult result =
          jobQueue.enqueueBulk(
              QueueName.BULK.id(),
              BulkEmailJobProcessor.JOB_TYPE,
              recipients,
              properties.bulkBatchSize(),
              batch -> new BulkEmailPayload(campaign, batch),
              properties.bulk().toOptions());
      logger.info(
          "bulk campaign enqueued campaign={} batches={} recipients={}",
          campaign,
          result.batches(),
          result.totalRecipients());
    }
    final List<DeliveryOutcome> outcomes = new ArrayList<>(messages.size());
    for (OutboundMessage message : messages) {
      outcomes.add(
          message.hasEmail() ? DeliveryOutcome.queuedForDelivery() : DeliveryOutcome.inAppOnly());
    }
    return Collections.unmodifiableList(outcomes);
  }

  private boolean isTransactionalEmail(OutboundMessage message) {
    final NotificationType type = message.type();
    return type.category() == NotificationCategory.TRANSACTIONAL
        && message.hasEmail()
        && !message.hasSms();
  }
}
