package com.opsdash.coordination.exception;

import com.opsdash.coordination.model.SystemEvent;

/**
 * A subscriber kept failing after every retry. Reported through notices only; never
 * thrown back to the publisher.
 */
public class SubscriptionCallbackException extends RuntimeException {

  private final String topic;
  private final transient SystemEvent event;

  public SubscriptionCallbackException(String topic, SystemEvent event, int attempts, Throwable cause) {
    super("Subscriber on " + topic + " failed for event " + event.id() + " after " + attempts + " attempt(s)", cause);
    this.topic = topic;
    this.event = event;
  }

  public String getTopic() {
    return topic;
  }

  public SystemEvent getEvent() {
    return event;
  }
}
