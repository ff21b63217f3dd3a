/*
 * どこで: Notification 再投入のユニットテスト
 * 何を: FAILED item から派生コピーを作る挙動と重複時のスキップを検証する
 * なぜ: 元の行を書き換えずに 1 回だけ再送されることを担保するため
 */
package com.matrimony.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.model.NotificationQueueItem;
import com.matrimony.notification.model.NotificationStatus;
import com.matrimony.notification.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

@ExtendWith(MockitoExtension.class)
class FailedNotificationRequeueServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private NotificationQueueRepository queueRepository;

  private FailedNotificationRequeueService service;

  @BeforeEach
  void setUp() {
    service =
        new FailedNotificationRequeueService(queueRepository, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void requeueCreatesPendingCopyLinkedToOriginal() {
    final NotificationQueueItem original = failed();
    when(queueRepository.findRequeueCandidates(FIXED_NOW.minus(Duration.ofHours(24)), 100))
        .thenReturn(List.of(original));

    assertThat(service.requeue(Duration.ofHours(24), 100)).isEqualTo(1);

    final ArgumentCaptor<NotificationQueueItem> captor =
        ArgumentCaptor.forClass(NotificationQueueItem.class);
    verify(queueRepository).insert(captor.capture());
    final NotificationQueueItem copy = captor.getValue();
    assertThat(copy.notificationId()).isNotEqualTo(original.notificationId());
    assertThat(copy.parentId()).isEqualTo(original.notificationId());
    assertThat(copy.status()).isEqualTo(NotificationStatus.PENDING);
    assertThat(copy.attempts()).isZero();
    assertThat(copy.scheduledFor()).isEqualTo(FIXED_NOW);
    assertThat(copy.channels()).isEqualTo(original.channels());
    assertThat(copy.templateDataJson()).isEqualTo(original.templateDataJson());
  }

  @Test
  void alreadyRequeuedOriginalIsSkipped() {
    when(queueRepository.findRequeueCandidates(any(), anyInt()))
        .thenReturn(List.of(failed(), failed()));
    when(queueRepository.insert(any()))
        .thenThrow(new DuplicateKeyException("uq_notification_queue_parent"))
        .thenReturn(UUID.randomUUID());

    assertThat(service.requeue(Duration.ofHours(1), 10)).isEqualTo(1);
    verify(queueRepository, times(2)).insert(any());
  }

  @Test
  void rejectsNonPositiveArguments() {
    assertThatThrownBy(() -> service.requeue(Duration.ZERO, 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.requeue(Duration.ofHours(1), 0))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(queueRepository);
  }

  private NotificationQueueItem failed() {
    return new NotificationQueueItem(
        UUID.randomUUID(),
        UUID.randomUUID(),
        null,
        "user-1",
        "new_match",
        NotificationPriority.HIGH,
        List.of(NotificationChannel.EMAIL),
        "{\"match\":{\"firstName\":\"Ravi\"}}",
        NotificationStatus.FAILED,
        1,
        FIXED_NOW.minusSeconds(7200),
        null,
        null,
        null,
        "email: provider rejected recipient",
        0,
        0,
        FIXED_NOW.minusSeconds(7200),
        FIXED_NOW.minusSeconds(3600),
        FIXED_NOW.minusSeconds(3600));
  }
}
