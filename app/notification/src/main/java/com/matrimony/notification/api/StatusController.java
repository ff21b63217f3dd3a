/*
 * どこで: Notification API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: actuator を見ずに生存確認できるようにするため
 */
package com.matrimony.notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "notification-scheduler: ok";
  }
}
