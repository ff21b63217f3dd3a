/*
 * どこで: Scheduler ジョブ実行
 * 何を: 再試行前の待機
 * なぜ: テストで retry_delay を実時間待たずに済ませるため
 */
package com.matrimony.notification.job;

import java.time.Duration;

@FunctionalInterface
public interface RetrySleeper {

  RetrySleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
