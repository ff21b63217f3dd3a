/*
 * どこで: Notification API
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、呼び出し側で code により機械的に分岐できるようにするため
 */
package com.matrimony.notification.api;

public record ApiErrorResponse(String code, String message) {}
