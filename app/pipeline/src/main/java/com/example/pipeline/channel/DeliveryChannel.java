/*
 * どこで: 配信チャネルのポート
 * 何を: プロバイダ経由でメール 1 通または SMS 1 通を送る
 * なぜ: queue 経路と直接経路で同じ同期契約を共有し、SDK を隠蔽するため
 */
package com.example.pipeline.channel;

/**
 * Outbound message transport.
 *
 * <p>Implementations report provider failures through {@link DeliveryResult#failure(String)}
 * instead of throwing, and never retry. Retry belongs to the job queue.
 */
public interface DeliveryChannel {

  DeliveryResult sendEmail(EmailMessage message);

  DeliveryResult sendSms(String to, String message);
}
