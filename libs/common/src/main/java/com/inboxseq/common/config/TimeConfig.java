/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 通知レコードの時刻付与をテストで固定できるようにするため
 */
package com.inboxseq.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
