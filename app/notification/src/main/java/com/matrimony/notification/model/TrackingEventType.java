package com.matrimony.notification.model;

public enum TrackingEventType {
  OPEN,
  CLICK
}
