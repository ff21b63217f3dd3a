/*
 * どこで: Notification アプリのインフラ設定
 * 何を: scheduler/executor/dispatch/tracking 用のスレッドプールを定義する
 * なぜ: 役割ごとにプールを分け、入れ子の待ち合わせでプールを枯渇させないため
 */
package com.matrimony.notification.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.matrimony.notification.job.RetrySleeper;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

  public static final String JOB_POOL = "schedulerJobPool";
  public static final String HANDLER_POOL = "jobHandlerPool";
  public static final String DISPATCH_ITEM_POOL = "dispatchItemPool";
  public static final String CHANNEL_SEND_POOL = "channelSendPool";
  public static final String TRACKING_POOL = "trackingPool";

  // 期限到来ジョブを並行に走らせる。各ジョブは handler pool 上の試行を待つだけ
  @Bean(name = JOB_POOL, destroyMethod = "shutdownNow")
  public ExecutorService schedulerJobPool(SchedulerProperties properties) {
    return Executors.newFixedThreadPool(properties.jobPoolSize(), daemonThreads("scheduler-job-%d"));
  }

  // ハンドラ本体。タイムアウト時は cancel(true) で割り込む
  @Bean(name = HANDLER_POOL, destroyMethod = "shutdownNow")
  public ExecutorService jobHandlerPool(SchedulerProperties properties) {
    return Executors.newFixedThreadPool(
        properties.handlerPoolSize(), daemonThreads("job-handler-%d"));
  }

  @Bean(name = DISPATCH_ITEM_POOL, destroyMethod = "shutdownNow")
  public ExecutorService dispatchItemPool(NotificationDeliveryProperties properties) {
    return Executors.newFixedThreadPool(
        properties.parallelism(), daemonThreads("dispatch-item-%d"));
  }

  @Bean(name = CHANNEL_SEND_POOL, destroyMethod = "shutdownNow")
  public ExecutorService channelSendPool(NotificationDeliveryProperties properties) {
    return Executors.newFixedThreadPool(
        properties.channelParallelism(), daemonThreads("channel-send-%d"));
  }

  @Bean(name = TRACKING_POOL, destroyMethod = "shutdown")
  public ExecutorService trackingPool(NotificationTrackingProperties properties) {
    return Executors.newFixedThreadPool(
        properties.executorPoolSize(), daemonThreads("tracking-%d"));
  }

  @Bean
  public RetrySleeper retrySleeper() {
    return RetrySleeper.THREAD_SLEEP;
  }

  private static ThreadFactory daemonThreads(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }
}
