package com.matrimony.notification.job;

public class DuplicateJobException extends RuntimeException {

  public DuplicateJobException(String name, Throwable cause) {
    super("job already exists: " + name, cause);
  }
}
