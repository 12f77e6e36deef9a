/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: 時刻取得を注入可能な Clock に通し、テストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
