/*
 * どこで: Notification API
 * 何を: push 用デバイストークンの登録/解除
 * なぜ: push アダプタが配信先トークンを channel_subscriptions から引けるようにするため
 */
package com.matrimony.notification.api;

import com.matrimony.notification.api.request.PushSubscriptionRequest;
import com.matrimony.notification.model.DevicePlatform;
import com.matrimony.notification.repository.ChannelSubscriptionRepository;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/push-subscriptions")
@RequiredArgsConstructor
public class PushSubscriptionController {

  private final ChannelSubscriptionRepository subscriptionRepository;
  private final Clock clock;

  @PostMapping
  public ResponseEntity<Void> register(@Valid @RequestBody PushSubscriptionRequest request) {
    subscriptionRepository.upsert(
        request.recipientId().trim(),
        request.deviceToken().trim(),
        DevicePlatform.fromValue(request.platform()),
        Instant.now(clock));
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{deviceToken}")
  public ResponseEntity<Void> deactivate(@PathVariable("deviceToken") String deviceToken) {
    final int updated = subscriptionRepository.deactivate(deviceToken, Instant.now(clock));
    return updated == 0 ? ResponseEntity.notFound().build() : ResponseEntity.noContent().build();
  }
}
