package com.matrimony.notification.model;

public record RetryPolicy(int maxRetries, long retryDelaySeconds) {

  public static final int MAX_RETRIES_LIMIT = 10;
  public static final long MAX_RETRY_DELAY_SECONDS = 86_400L;

  public RetryPolicy {
    if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
      throw new IllegalArgumentException(
          "max_retries must be between 0 and " + MAX_RETRIES_LIMIT);
    }
    if (retryDelaySeconds < 0 || retryDelaySeconds > MAX_RETRY_DELAY_SECONDS) {
      throw new IllegalArgumentException(
          "retry_delay_seconds must be between 0 and " + MAX_RETRY_DELAY_SECONDS);
    }
  }

  public static RetryPolicy none() {
    return new RetryPolicy(0, 0);
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }
}
