/*
 * どこで: 通知ディスパッチ
 * 何を: retry なしで配信チャネルを同期呼び出しする
 * なぜ: queue が job を受け付けられない間の縮退経路
 */
package com.example.pipeline.dispatch;

import com.example.pipeline.channel.DeliveryChannel;
import com.example.pipeline.channel.DeliveryResult;
import com.example.pipeline.config.DeliveryProperties;
import com.example.pipeline.metrics.PipelineMetrics;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DirectDelivery implements DeliveryStrategy {

  private static final Logger logger = LoggerFactory.getLogger(DirectDelivery.class);

  private final DeliveryChannel deliveryChannel;
  private final DeliveryProperties properties;
  private final PipelineMetrics metrics;

  @Override
  public String name() {
    return "direct";
  }

  @Override
  public DeliveryOutcome deliver(OutboundMessage message) {
    if (message.isInAppOnly()) {
      return DeliveryOutcome.inAppOnly();
    }
    final boolean emailSent = message.hasEmail() && sendEmail(message);
    final boolean smsSent = message.hasSms() && sendSms(message);
    return DeliveryOutcome.of(message, emailSent, smsSent);
  }

  @Override
  public List<DeliveryOutcome> deliverBulk(String campaign, List<OutboundMessage> messages) {
    final List<DeliveryOutcome> outcomes = new ArrayList<>(messages.size());
    for (int i = 0; i < messages.size(); i++) {
      final OutboundMessage message = messages.get(i);
      final boolean emailSent = message.hasEmail() && sendEmail(message);
      outcomes.add(DeliveryOutcome.of(message, emailSent, false));
      if (i < messages.size() - 1 && !pause(properties.bulkSendPause())) {
        // 中断時は残りの受信者を未配信として返す
        for (int j = i + 1; j < messages.size(); j++) {
          outcomes.add(DeliveryOutcome.of(messages.get(j), false, false));
        }
        logger.warn("direct bulk send interrupted campaign={} remaining={}", campaign, messages.size() - i - 1);
        break;
      }
    }
    return outcomes;
  }

  private boolean sendEmail(OutboundMessage message) {
    try {
      final DeliveryResult result = deliveryChannel.sendEmail(message.email());
      if (!result.success()) {
        metrics.recordChannelResult("email", "direct_failed");
        logger.warn(
            "direct email failed userId={} type={} error={}",
            message.userId(),
            message.type().code(),
            result.error());
      }
      return result.success();
    } catch (RuntimeException ex) {
      metrics.recordChannelResult("email", "direct_failed");
      logger.warn("direct email raised userId={} type={}", message.userId(), message.type().code(), ex);
      return false;
    }
  }

  private boolean sendSms(OutboundMessage message) {
    try {
      final DeliveryResult result = deliveryChannel.sendSms(message.smsTo(), message.smsText());
      if (!result.success()) {
        metrics.recordChannelResult("sms", "direct_failed");
        logger.warn("direct sms failed userId={} error={}", message.userId(), result.error());
      }
      return result.success();
    } catch (RuntimeException ex) {
      metrics.recordChannelResult("sms", "direct_failed");
      logger.warn("direct sms raised userId={}", message.userId(), ex);
      return false;
    }
  }

  private boolean pause(Duration duration) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(duration.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
