package com.matrimony.notification.model;

public enum ScheduleKind {
  INTERVAL,
  CRON
}
