package com.opsdash.coordination.exception;

/** The message broker could not be reached. Retryable by the caller. */
public class BusConnectionException extends RuntimeException {

  public BusConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
