/*
 * どこで: 配信チャネル実装
 * 何を: プロバイダを呼ばずにメッセージをログへ出す
 * なぜ: ローカル/CI で常に成功するチャネルが必要なため
 */
package com.example.pipeline.channel;

import com.example.pipeline.metrics.PipelineMetrics;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SimulatedDeliveryChannel implements DeliveryChannel {

  private static final Logger logger = LoggerFactory.getLogger(SimulatedDeliveryChannel.class);
  static final String MESSAGE_ID_PREFIX = "simulated-";

  private final PipelineMetrics metrics;
  private final Clock clock;

  @Override
  public DeliveryResult sendEmail(EmailMessage message) {
    final String messageId = nextMessageId();
    logger.info(
        "simulated email sent to={} subject={} attachments={} messageId={}",
        message.to(),
        message.subject(),
        message.attachments().size(),
        messageId);
    metrics.recordChannelResult("email", "sent");
    return DeliveryResult.sent(messageId);
  }

  @Override
  public DeliveryResult sendSms(String to, String message) {
    final String messageId = nextMessageId();
    logger.info("simulated sms sent to={} length={} messageId={}", to, message.length(), messageId);
    metrics.recordChannelResult("sms", "sent");
    return DeliveryResult.sent(messageId);
  }

  private String nextMessageId() {
    return MESSAGE_ID_PREFIX + clock.millis();
  }
}
