/*
 * どこで: Job processor（bulk queue）
 * 何を: レンダリング済みメール 1 バッチを間隔を空けて送り、その後に履歴行を書く
 * なぜ: バッチ全体を失敗させずにプロバイダのレート制限を守るため
 */
package com.example.pipeline.queue.processor;

import com.example.pipeline.channel.DeliveryChannel;
import com.example.pipeline.channel.DeliveryResult;
import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.config.DeliveryProperties;
import com.example.pipeline.notification.Notification;
import com.example.pipeline.queue.JobContext;
import com.example.pipeline.queue.JobProcessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BulkEmailJobProcessor implements JobProcessor {

  public static final String JOB_TYPE = "send-bulk";

  private static final Logger logger = LoggerFactory.getLogger(BulkEmailJobProcessor.class);

  private final DeliveryChannel deliveryChannel;
  private final ObjectMapper objectMapper;
  private final DeliveryProperties properties;
  private final DeliveryHistoryRecorder historyRecorder;

  @Override
  public BulkSendReport process(JobContext context)
      throws JsonProcessingException, InterruptedException {
    final BulkEmailPayload payload =
        objectMapper.treeToValue(context.payload(), BulkEmailPayload.class);
    final List<BulkRecipient> recipients = payload.recipients();
    final List<BulkSendReport.RecipientResult> results = new ArrayList<>(recipients.size());
    final List<Notification> rows = new ArrayList<>(recipients.size());
    int sent = 0;
    try {
      for (int i = 0; i < recipients.size(); i++) {
        final BulkRecipient recipient = recipients.get(i);
        final BulkSendReport.RecipientResult result = sendOne(recipient.email());
        if (result.success()) {
          sent++;
        }
        results.add(result);
        if (recipient.history() != null) {
          rows.add(
              recipient.history().toNotification(result.success(), false, historyRecorder.now()));
        }
        context.progress().report((i + 1) * 100 / recipients.size());
        if (i < recipients.size() - 1) {
          pause(properties.bulkSendPause());
        }
      }
    } finally {
      // 前提: バッチが中断されても、送信を試みた受信者の行は残す
      historyRecorder.recordAll(rows);
    }
    final int failed = recipients.size() - sent;
    logger.info(
        "bulk batch finished jobId={} campaign={} total={} sent={} failed={}",
        context.jobId(),
        payload.campaign(),
        recipients.size(),
        sent,
        failed);
    return new BulkSendReport(recipients.size(), sent, failed, results);
  }

  private BulkSendReport.RecipientResult sendOne(EmailMessage message) {
    if (!message.hasValidRecipient()) {
      return new BulkSendReport.RecipientResult(message.to(), false, null, "invalid recipient address");
    }
    try {
      final DeliveryResult result = deliveryChannel.sendEmail(message);
      return new BulkSendReport.RecipientResult(
          message.to(), result.success(), result.messageId(), result.error());
    } catch (RuntimeException ex) {
      logger.warn("bulk recipient send failed to={}", message.to(), ex);
      return new BulkSendReport.RecipientResult(message.to(), false, null, ex.getMessage());
    }
  }

  private void pause(Duration duration) throws InterruptedException {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return;
    }
    Thread.sleep(duration.toMillis());
  }
}
