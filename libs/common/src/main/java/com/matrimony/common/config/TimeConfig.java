/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: スケジューラと配信処理で同一の時刻注入を使うため
 */
package com.matrimony.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // テストが固定 Clock を差し込んだ場合はそちらを優先する
  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }
}
