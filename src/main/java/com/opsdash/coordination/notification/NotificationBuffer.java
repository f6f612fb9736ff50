package com.opsdash.coordination.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.coordination.enums.NoticeType;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Recent coordination notices plus their Server-Sent Events relay. Each SSE event is
 * named after the notice type ({@code agent-status-changed}, ...) and carries the notice
 * id, so dashboards can subscribe to a subset of types.
 */
@Component
public class NotificationBuffer {

  private static final Logger log = LoggerFactory.getLogger(NotificationBuffer.class);

  private final Deque<CoordinationNotice> recent;
  private final List<Listener> listeners = new CopyOnWriteArrayList<>();
  private final ObjectMapper objectMapper;

  public NotificationBuffer(ObjectMapper objectMapper,
                            @Value("${coordination.notifications.buffer-size:200}") int capacity) {
    this.objectMapper = objectMapper;
    this.recent = new LinkedBlockingDeque<>(Math.max(1, capacity));
  }

  public void push(CoordinationNotice notice) {
    synchronized (recent) {
      if (!recent.offerFirst(notice)) {
        recent.pollLast();
        recent.offerFirst(notice);
      }
    }
    listeners.forEach(listener -> deliver(listener, notice));
  }

  /** Newest first, optionally narrowed to {@code types}. */
  public List<CoordinationNotice> getRecent(Set<NoticeType> types, int limit) {
    List<CoordinationNotice> matching = new ArrayList<>();
    for (CoordinationNotice notice : recent) {
      if (matching.size() >= limit) {
        break;
      }
      if (types == null || types.isEmpty() || types.contains(notice.type())) {
        matching.add(notice);
      }
    }
    return matching;
  }

  /**
   * Opens a stream for the given notice types (all when empty). With {@code backlog} > 0
   * the newest matching notices are sent first, oldest to newest.
   */
  public SseEmitter subscribe(Set<NoticeType> types, int backlog) {
    Set<NoticeType> wanted = types == null || types.isEmpty()
        ? EnumSet.allOf(NoticeType.class)
        : EnumSet.copyOf(types);
    Listener listener = new Listener(new SseEmitter(0L), wanted);
    listener.emitter().onCompletion(() -> listeners.remove(listener));
    listener.emitter().onTimeout(() -> listeners.remove(listener));
    listener.emitter().onError(e -> listeners.remove(listener));

    if (backlog > 0) {
      List<CoordinationNotice> missed = getRecent(wanted, backlog);
      for (int i = missed.size() - 1; i >= 0; i--) {
        deliver(listener, missed.get(i));
      }
    }
    listeners.add(listener);
    log.debug("Notice stream opened for {} type(s), {} listener(s) connected", wanted.size(), listeners.size());
    return listener.emitter();
  }

  public int listenerCount() {
    return listeners.size();
  }

  private void deliver(Listener listener, CoordinationNotice notice) {
    if (!listener.types().contains(notice.type())) {
      return;
    }
    try {
      listener.emitter().send(SseEmitter.event()
          .id(notice.id())
          .name(eventName(notice.type()))
          .data(toJson(notice)));
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize notice {}", notice.id(), e);
    } catch (IOException | IllegalStateException e) {
      log.debug("Closing notice stream after send failure: {}", e.getMessage());
      listeners.remove(listener);
      listener.emitter().completeWithError(e);
    }
  }

  private String toJson(CoordinationNotice notice) throws JsonProcessingException {
    return objectMapper.writeValueAsString(notice);
  }

  static String eventName(NoticeType type) {
    return type.name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  private record Listener(SseEmitter emitter, Set<NoticeType> types) {}
}
