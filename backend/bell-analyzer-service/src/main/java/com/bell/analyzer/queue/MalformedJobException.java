package com.bell.analyzer.queue;

public class MalformedJobException extends RuntimeException {

  public MalformedJobException(String message) {
    super(message);
  }

  public MalformedJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
