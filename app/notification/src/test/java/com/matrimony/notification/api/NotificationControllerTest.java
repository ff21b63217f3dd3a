package com.matrimony.notification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.service.EnqueueNotificationCommand;
import com.matrimony.notification.service.NotificationQueueService;
import com.matrimony.notification.service.NotificationSuppressedException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationControllerTest {

  private static final UUID NOTIFICATION_ID =
      UUID.fromString("a4d0b4de-8a8e-4f0a-9a57-3c8d2f1b6e01");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationQueueService queueService;

  @Test
  void enqueueReturns202WithPendingStatus() throws Exception {
    when(queueService.enqueue(any(EnqueueNotificationCommand.class))).thenReturn(NOTIFICATION_ID);

    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "event_id": "5b0f3f0e-1c1d-4b8e-8d7f-0a9c6e2b4d11",
                      "recipient_id": "user-1",
                      "trigger": "new_match",
                      "channels": ["email", "PUSH"],
                      "priority": "high",
                      "template_data": {"match": {"firstName": "Ravi", "score": 85}},
                      "scheduled_for": "2026-03-10T09:00:00Z"
                    }
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.notification_id").value(NOTIFICATION_ID.toString()))
        .andExpect(jsonPath("$.status").value("PENDING"));

    final ArgumentCaptor<EnqueueNotificationCommand> captor =
        ArgumentCaptor.forClass(EnqueueNotificationCommand.class);
    verify(queueService).enqueue(captor.capture());
    final EnqueueNotificationCommand command = captor.getValue();
    assertThat(command.channels())
        .containsExactly(NotificationChannel.EMAIL, NotificationChannel.PUSH);
    assertThat(command.priority()).isEqualTo(NotificationPriority.HIGH);
    assertThat(command.scheduledFor()).isEqualTo(Instant.parse("2026-03-10T09:00:00Z"));
    assertThat(command.templateData()).containsKey("match");
    assertThat(command.templateData().get("match"))
        .isInstanceOfSatisfying(
            Map.class, match -> assertThat(match.get("firstName")).isEqualTo("Ravi"));
  }

  @Test
  void priorityDefaultsToMedium() throws Exception {
    when(queueService.enqueue(any(EnqueueNotificationCommand.class))).thenReturn(NOTIFICATION_ID);

    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recipient_id":"user-1","trigger":"new_message","channels":["sms"]}
                    """))
        .andExpect(status().isAccepted());

    final ArgumentCaptor<EnqueueNotificationCommand> captor =
        ArgumentCaptor.forClass(EnqueueNotificationCommand.class);
    verify(queueService).enqueue(captor.capture());
    assertThat(captor.getValue().priority()).isEqualTo(NotificationPriority.MEDIUM);
    assertThat(captor.getValue().channels()).isEqualTo(List.of(NotificationChannel.SMS));
  }

  @Test
  void unknownChannelIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recipient_id":"user-1","trigger":"new_match","channels":["fax"]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("unknown channel: fax"));

    verify(queueService, never()).enqueue(any());
  }

  @Test
  void emptyChannelsFailValidation() throws Exception {
    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recipient_id":"user-1","trigger":"new_match","channels":[]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));
  }

  @Test
  void brokenJsonIsMalformed() throws Exception {
    mockMvc
        .perform(post("/v1/notifications").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_MALFORMED_REQUEST"));
  }

  @Test
  void unexpectedFailureIsHidden() throws Exception {
    when(queueService.enqueue(any(EnqueueNotificationCommand.class)))
        .thenThrow(new IllegalStateException("connection refused to db-primary:5432"));

    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recipient_id":"user-1","trigger":"new_match","channels":["email"]}
                    """))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }

  @Test
  void rateLimitedRecipientGets429() throws Exception {
    when(queueService.enqueue(any(EnqueueNotificationCommand.class)))
        .thenThrow(
            new NotificationSuppressedException(
                NotificationSuppressedException.Reason.RATE_LIMITED, "rate limit exceeded"));

    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recipient_id":"user-1","trigger":"new_match","channels":["sms"]}
                    """))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_RATE_LIMITED"));
  }

  @Test
  void optedOutTriggerIsRejected() throws Exception {
    when(queueService.enqueue(any(EnqueueNotificationCommand.class)))
        .thenThrow(
            new NotificationSuppressedException(
                NotificationSuppressedException.Reason.OPTED_OUT,
                "recipient has disabled new_match notifications"));

    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recipient_id":"user-1","trigger":"new_match","channels":["email"]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_OPTED_OUT"));
  }
}
