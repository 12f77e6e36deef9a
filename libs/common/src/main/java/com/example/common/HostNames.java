/*
 * どこで: 共通ユーティリティ
 * 何を: 共有行をロックするときにこのプロセスが使う識別子を決める
 * なぜ: Pod やローカル実行をまたいでリース所有者を識別できるようにするため
 */
package com.example.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HostNames {

  private static final Logger logger = LoggerFactory.getLogger(HostNames.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  public static final String DEFAULT_HOSTNAME = "unknown-host";

  private HostNames() {}

  public static String resolve() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
