package com.opsdash.coordination.bus;

import com.opsdash.coordination.model.SystemEvent;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A local subscription. Events rejected by {@code filter} are dropped before the
 * handler runs; a null filter accepts everything.
 */
public record EventSubscription(
    String topic,
    EventHandler handler,
    Predicate<SystemEvent> filter
) {

  public EventSubscription {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(handler, "handler");
  }

  public static EventSubscription of(String topic, EventHandler handler) {
    return new EventSubscription(topic, handler, null);
  }

  boolean accepts(SystemEvent event) {
    return filter == null || filter.test(event);
  }
}
