package com.opsdash.coordination.exception;

public class NotConnectedException extends IllegalStateException {

  public NotConnectedException() {
    super("Event bus is not connected");
  }
}
