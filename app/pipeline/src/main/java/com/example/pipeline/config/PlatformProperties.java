/*
 * どこで: Pipeline 設定バインド
 * 何を: 周辺プラットフォームの情報（ローカルタイムゾーンと公開 URL）
 */
package com.example.pipeline.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.platform")
public record PlatformProperties(ZoneId zone, String baseUrl) {

  public String link(String path) {
    final String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return base + path;
  }
}
