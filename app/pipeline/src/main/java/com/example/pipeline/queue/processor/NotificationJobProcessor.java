/*
 * どこで: Job processor（notification / email queue）
 * 何を: ユーザー通知のメールと任意の SMS を送り、その後に履歴行を書く
 * なぜ: プロバイダが実際に受け付けた結果を行に残すため
 */
package com.example.pipeline.queue.processor;

import com.example.pipeline.channel.DeliveryChannel;
import com.example.pipeline.channel.DeliveryFailedException;
import com.example.pipeline.channel.DeliveryResult;
import com.example.pipeline.queue.JobContext;
import com.example.pipeline.queue.JobProcessor;
import com.example.pipeline.queue.PermanentJobFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Email failures are retried; the history row is written once, either after the successful send
 * or when the last attempt fails (then with {@code email_envoye = false}).
 */
@Component
@RequiredArgsConstructor
public class NotificationJobProcessor implements JobProcessor {

  public static final String JOB_TYPE = "send-notification";

  private static final Logger logger = LoggerFactory.getLogger(NotificationJobProcessor.class);

  private final DeliveryChannel deliveryChannel;
  private final ObjectMapper objectMapper;
  private final DeliveryHistoryRecorder historyRecorder;

  @Override
  public Map<String, Object> process(JobContext context) throws JsonProcessingException {
    final NotificationJobPayload payload =
        objectMapper.treeToValue(context.payload(), NotificationJobPayload.class);
    final Map<String, Object> result = new LinkedHashMap<>();
    boolean emailSent = false;
    if (payload.hasEmail()) {
      if (!payload.email().hasValidRecipient()) {
        historyRecorder.record(payload.history(), false, false);
        throw new PermanentJobFailureException(
            "invalid recipient address userId=" + payload.userId());
      }
      final DeliveryResult email = sendEmail(payload);
      if (!email.success()) {
        if (context.isLastAttempt()) {
          historyRecorder.record(payload.history(), false, false);
        }
        throw new DeliveryFailedException(
            "notification email failed userId=" + payload.userId() + " error=" + email.error());
      }
      emailSent = true;
      result.put("emailMessageId", email.messageId());
    }
    // 前提: SMS はメール送信後にのみ送り、失敗しても job は失敗させない
    boolean smsSent = false;
    if (payload.hasSms()) {
      final DeliveryResult sms = sendSms(payload);
      if (sms.success()) {
        smsSent = true;
        result.put("smsMessageId", sms.messageId());
      } else {
        logger.warn(
            "notification sms failed userId={} jobId={} error={}",
            payload.userId(),
            context.jobId(),
            sms.error());
        result.put("smsError", sms.error());
      }
    }
    historyRecorder.record(payload.history(), emailSent, smsSent);
    return result;
  }

  private DeliveryResult sendEmail(NotificationJobPayload payload) {
    try {
      return deliveryChannel.sendEmail(payload.email());
    } catch (RuntimeException ex) {
      logger.warn("notification email raised userId={}", payload.userId(), ex);
      return DeliveryResult.failure(ex.getMessage());
    }
  }

  private DeliveryResult sendSms(NotificationJobPayload payload) {
    try {
      return deliveryChannel.sendSms(payload.smsTo(), payload.smsText());
    } catch (RuntimeException ex) {
      logger.warn("notification sms raised userId={}", payload.userId(), ex);
      return DeliveryResult.failure(ex.getMessage());
    }
  }
}
