package com.matrimony.notification.service;

public record RetentionSummary(
    int staleActive, int deletedNotifications, int deletedProcessedEvents, int deletedTrackingEvents) {

  public int deletedTotal() {
    return deletedNotifications + deletedProcessedEvents + deletedTrackingEvents;
  }
}
