package com.example.sessionguard.exception;

/**
 * Session Exception - a session could not be written or is not usable
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }

  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
