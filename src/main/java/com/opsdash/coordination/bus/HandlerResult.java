package com.opsdash.coordination.bus;

public record HandlerResult(boolean success, String message, Throwable error) {

  private static final HandlerResult OK = new HandlerResult(true, null, null);

  public static HandlerResult ok() {
    return OK;
  }

  public static HandlerResult failed(String message) {
    return new HandlerResult(false, message, null);
  }

  public static HandlerResult failed(Throwable error) {
    return new HandlerResult(false, error.getMessage(), error);
  }

  Throwable asThrowable() {
    return error != null ? error : new IllegalStateException(message);
  }
}
