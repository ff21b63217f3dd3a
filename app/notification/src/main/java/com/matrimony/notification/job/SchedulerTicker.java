/*
 * どこで: Scheduler
 * 何を: 一定間隔で JobSchedulerLoop.tick() を呼ぶ
 * なぜ: tick の駆動を Spring のスケジューラに任せ、テストでは tick() を直接呼べるようにするため
 */
package com.matrimony.notification.job;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerTicker {

  private final JobSchedulerLoop loop;

  @Scheduled(fixedDelayString = "${scheduler.tick-interval}")
  public void run() {
    loop.tick();
  }
}
