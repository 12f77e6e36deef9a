/*
 * どこで: 通知ディスパッチ
 * 何を: レンダリング済み通知をチャネルへ届ける方式
 * なぜ: queue 経由と直接配信を呼び出し時に切り替えられるようにするため
 */
package com.example.pipeline.dispatch;

import java.util.List;

public interface DeliveryStrategy {

  String name();

  DeliveryOutcome deliver(OutboundMessage message);

  /** Email-only fan-out; the returned list is index-aligned with {@code messages}. */
  List<DeliveryOutcome> deliverBulk(String campaign, List<OutboundMessage> messages);
}
