/*
 * どこで: 配信チャネル実装（CI/テスト専用）
 * 何を: 宛先が設定 prefix に一致する配信を失敗させる
 * なぜ: 本番経路に触れずに retry と FAILED job を E2E で検証するため
 */
package com.example.pipeline.channel;

import com.example.pipeline.metrics.PipelineMetrics;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "pipeline.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingDeliveryChannel implements DeliveryChannel {

  private static final Logger logger =
      LoggerFactory.getLogger(FailureInjectingDeliveryChannel.class);

  private final SimulatedDeliveryChannel delegate;
  private final PipelineMetrics metrics;

  @Value("${pipeline.delivery.failure-injection.recipient-prefix:}")
  private String recipientPrefix;

  @Value("${pipeline.delivery.failure-injection.latency:0ms}")
  private Duration latency;

  @Override
  public DeliveryResult sendEmail(EmailMessage message) {
    final DeliveryResult injected = injectedFailure("email", message.to());
    return injected != null ? injected : delegate.sendEmail(message);
  }

  @Override
  public DeliveryResult sendSms(String to, String message) {
    final DeliveryResult injected = injectedFailure("sms", to);
    return injected != null ? injected : delegate.sendSms(to, message);
  }

  private DeliveryResult injectedFailure(String channel, String recipient) {
    pause();
    if (!shouldInjectFailure(recipient)) {
      return null;
    }
    logger.warn("delivery failure injected channel={} recipient={}", channel, recipient);
    metrics.recordChannelResult(channel, "failed");
    return DeliveryResult.failure("delivery failure injection matched recipient=" + recipient);
  }

  private boolean shouldInjectFailure(String recipient) {
    if (recipientPrefix == null || recipientPrefix.isBlank() || recipient == null) {
      return false;
    }
    return recipient.startsWith(recipientPrefix);
  }

  private void pause() {
    if (latency == null || latency.isZero() || latency.isNegative()) {
      return;
    }
    try {
      Thread.sleep(latency.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("injected latency interrupted");
    }
  }
}
