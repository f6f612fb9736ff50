package com.opsdash.coordination.bus;

import com.opsdash.coordination.enums.EventType;
import com.opsdash.coordination.model.SystemEvent;

public final class TopicNames {

  public static final String ALL = "events:all";
  public static final String TIMELINE = "events:timeline";
  public static final String EVENT_KEY_PREFIX = "event:";

  private TopicNames() {}

  /** {@code events:{type}} or {@code events:{type}:{source}} when the event has a source. */
  public static String forEvent(SystemEvent event) {
    String base = forType(event.type());
    return event.hasSource() ? base + ":" + event.source() : base;
  }

  public static String forType(EventType type) {
    return "events:" + type.value();
  }

  /** Pattern matching every source-qualified topic of {@code type}. */
  public static String sourcesOf(EventType type) {
    return forType(type) + ":*";
  }

  /** Pattern an agent subscribes to for the copies routed to it. */
  public static String routedTo(String agentId) {
    return "events:*:" + routedSource(agentId);
  }

  public static String routedSource(String agentId) {
    return "orchestrator-to-" + agentId;
  }

  static String eventKey(String eventId) {
    return EVENT_KEY_PREFIX + eventId;
  }
}
