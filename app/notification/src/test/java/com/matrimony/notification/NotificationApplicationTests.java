/*
 * どこで: Notification アプリのスモークテスト
 * 何を: Spring コンテキストの起動と静的ジョブの登録を確認する
 * なぜ: 主要な構成が破壊されていないことを担保するため
 */
package com.matrimony.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.matrimony.notification.job.JobRegistry;
import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.model.JobOrigin;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private JobRegistry jobRegistry;

  @Test
  void contextLoadsAndRegistersStaticJobs() {
    assertThat(jobRegistry.list())
        .filteredOn(job -> job.origin() == JobOrigin.STATIC)
        .extracting(JobDefinition::name)
        .contains(
            "notification-dispatch",
            "notification-retention",
            "failed-notification-requeue",
            "execution-history-cleanup");
    assertThat(jobRegistry.get("failed-notification-requeue").enabled()).isFalse();
  }
}
