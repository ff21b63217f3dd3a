/*
 * どこで: Notification API
 * 何を: 受信者の配信設定の参照/更新
 * なぜ: アプリの設定画面から opt-in・静穏時間帯・レート制限を変更できるようにするため
 */
package com.matrimony.notification.api;

import com.matrimony.notification.api.request.NotificationPreferencesRequest;
import com.matrimony.notification.api.response.NotificationPreferencesResponse;
import com.matrimony.notification.service.NotificationPreferenceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notification-preferences")
@RequiredArgsConstructor
public class NotificationPreferenceController {

  private final NotificationPreferenceService preferenceService;

  @GetMapping("/{recipientId}")
  public NotificationPreferencesResponse get(@PathVariable("recipientId") String recipientId) {
    return NotificationPreferencesResponse.from(preferenceService.get(recipientId));
  }

  @PutMapping("/{recipientId}")
  public NotificationPreferencesResponse put(
      @PathVariable("recipientId") String recipientId,
      @Valid @RequestBody NotificationPreferencesRequest request) {
    return NotificationPreferencesResponse.from(
        preferenceService.save(request.toPreferences(recipientId)));
  }
}
