/*
 * どこで: Pipeline アプリのエントリポイント
 * 何を: Spring を起動し、設定スキャンとスケジューリングを有効にする
 */
package com.example.pipeline;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class PipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(PipelineApplication.class, args);
  }
}
