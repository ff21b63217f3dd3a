package com.matrimony.notification.job;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String name) {
    super("job not found: " + name);
  }
}
