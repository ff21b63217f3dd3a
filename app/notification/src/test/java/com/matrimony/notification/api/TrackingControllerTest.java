/*
 * どこで: Tracking API の Web 層テスト
 * 何を: ピクセル応答、クリックのリダイレクト検証、分析 API のエラー変換を検証する
 * なぜ: 計測失敗でもメール表示やリンク遷移を壊さないことを保証するため
 */
package com.matrimony.notification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.matrimony.notification.service.ClientMetadata;
import com.matrimony.notification.service.NotificationNotFoundException;
import com.matrimony.notification.service.TrackingAnalyticsService;
import com.matrimony.notification.service.TrackingAnalyticsService.AnalyticsSummary;
import com.matrimony.notification.service.TrackingAnalyticsService.ClickDetail;
import com.matrimony.notification.service.TrackingAnalyticsService.MessageAnalytics;
import com.matrimony.notification.service.TrackingCollector;
import java.time.Instant;
import java.util.List;
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

@WebMvcTest(TrackingController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class TrackingControllerTest {

  private static final UUID TRACKING_ID = UUID.fromString("6f1c1a8e-4f4a-4a55-9d55-2d3b0b7a9c11");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TrackingCollector collector;
  @MockitoBean private TrackingAnalyticsService analyticsService;

  @Test
  void pixelReturnsPngAndRecordsOpen() throws Exception {
    mockMvc
        .perform(
            get("/tracking/pixel/" + TRACKING_ID)
                .header("User-Agent", "Mail/1.0")
                .header("X-Forwarded-For", "198.51.100.7, 10.0.0.1")
                .with(
                    request -> {
                      request.setRemoteAddr("203.0.113.9");
                      return request;
                    }))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG))
        .andExpect(content().bytes(TrackingController.PIXEL))
        .andExpect(header().string("Pragma", "no-cache"));

    final ArgumentCaptor<ClientMetadata> client = ArgumentCaptor.forClass(ClientMetadata.class);
    verify(collector).recordOpen(eq(TRACKING_ID), client.capture());
    assertThat(client.getValue().ipAddress()).isEqualTo("203.0.113.9");
    assertThat(client.getValue().userAgent()).isEqualTo("Mail/1.0");
  }

  @Test
  void pixelIsServedEvenForMalformedTrackingId() throws Exception {
    mockMvc
        .perform(get("/tracking/pixel/not-a-uuid"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG));

    verifyNoInteractions(collector);
  }

  @Test
  void clickRedirectsAndRecordsDestination() throws Exception {
    mockMvc
        .perform(
            get("/tracking/click/" + TRACKING_ID)
                .param("url", "https://app.example.com/profile/42")
                .param("type", "view_profile"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "https://app.example.com/profile/42"));

    verify(collector)
        .recordClick(
            eq(TRACKING_ID),
            eq("view_profile"),
            eq("https://app.example.com/profile/42"),
            any(ClientMetadata.class));
  }

  @Test
  void clickUsesGenericLinkTypeWhenMissing() throws Exception {
    mockMvc
        .perform(get("/tracking/click/" + TRACKING_ID).param("url", "http://app.example.com/"))
        .andExpect(status().isFound());

    verify(collector)
        .recordClick(eq(TRACKING_ID), eq("generic"), anyString(), any(ClientMetadata.class));
  }

  @Test
  void clickRejectsNonHttpRedirect() throws Exception {
    mockMvc
        .perform(
            get("/tracking/click/" + TRACKING_ID).param("url", "javascript:alert(1)"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_BAD_REQUEST"));

    verifyNoInteractions(collector);
  }

  @Test
  void clickWithoutUrlIsMalformed() throws Exception {
    mockMvc
        .perform(get("/tracking/click/" + TRACKING_ID))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_MALFORMED_REQUEST"));
  }

  @Test
  void analyticsReturnsSnakeCasePayload() throws Exception {
    when(analyticsService.messageAnalytics(TRACKING_ID))
        .thenReturn(
            new MessageAnalytics(
                TRACKING_ID,
                true,
                3,
                2,
                Instant.parse("2026-03-10T09:00:00Z"),
                1,
                List.of(
                    new ClickDetail(
                        "view_profile",
                        "https://app.example.com/profile/42",
                        Instant.parse("2026-03-10T09:05:00Z"))),
                33.33));

    mockMvc
        .perform(get("/tracking/analytics/" + TRACKING_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tracking_id").value(TRACKING_ID.toString()))
        .andExpect(jsonPath("$.open_count").value(3))
        .andExpect(jsonPath("$.unique_opens").value(2))
        .andExpect(jsonPath("$.clicks[0].link_type").value("view_profile"))
        .andExpect(jsonPath("$.engagement_rate").value(33.33));
  }

  @Test
  void analyticsReturns404WhenNotificationUnknown() throws Exception {
    when(analyticsService.messageAnalytics(TRACKING_ID))
        .thenThrow(new NotificationNotFoundException(TRACKING_ID));

    mockMvc
        .perform(get("/tracking/analytics/" + TRACKING_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_NOT_FOUND"));
  }

  @Test
  void summaryDefaultsToThirtyDays() throws Exception {
    when(analyticsService.summary(30))
        .thenReturn(new AnalyticsSummary(30, 200, 40, 10, 25, 12.5, 5.0, 25.0));

    mockMvc
        .perform(get("/tracking/stats/summary"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.period_days").value(30))
        .andExpect(jsonPath("$.total_emails_sent").value(200))
        .andExpect(jsonPath("$.open_rate").value(12.5));
  }

  @Test
  void summaryRejectsNonNumericDays() throws Exception {
    mockMvc
        .perform(get("/tracking/stats/summary").param("days", "week"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_MALFORMED_REQUEST"));
  }
}
