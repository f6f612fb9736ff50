package com.opsdash.coordination.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsdash.coordination.bus.transport.BusTransport;
import com.opsdash.coordination.enums.NoticeType;
import com.opsdash.coordination.exception.BusConnectionException;
import com.opsdash.coordination.exception.NotConnectedException;
import com.opsdash.coordination.exception.SubscriptionCallbackException;
import com.opsdash.coordination.model.SystemEvent;
import com.opsdash.coordination.notification.CoordinationNotice;
import com.opsdash.coordination.notification.NotificationService;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Topic-addressed publish/subscribe over a {@link BusTransport}, with per-subscriber
 * retry and a persisted sliding-window timeline for history and replay.
 *
 * <p>All local subscribers of one topic share a single broker subscription. Each
 * inbound event is handed to every matching subscriber independently: one failing
 * handler never keeps the others from running, and its failure is reported as a
 * {@link NoticeType#SUBSCRIPTION_ERROR} notice rather than thrown to the publisher.
 */
public class EventBus {

  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  public static final int DEFAULT_HISTORY_LIMIT = 100;
  static final int REPLAY_LIMIT = 1000;

  private final BusTransport transport;
  private final ObjectMapper objectMapper;
  private final NotificationService notifications;
  private final EventBusSettings settings;
  private final Clock clock;
  private final Map<String, List<EventSubscription>> subscriptions = new ConcurrentHashMap<>();
  private final ScheduledExecutorService dispatchExecutor;
  private final RetryRegistry retryRegistry;

  private volatile boolean connected;

  public EventBus(BusTransport transport,
                  ObjectMapper objectMapper,
                  NotificationService notifications,
                  EventBusSettings settings,
                  Clock clock) {
    this.transport = transport;
    this.objectMapper = objectMapper;
    this.notifications = notifications;
    this.settings = settings;
    this.clock = clock;
    AtomicInteger threadCounter = new AtomicInteger();
    this.dispatchExecutor = Executors.newScheduledThreadPool(settings.dispatchThreads(), r -> {
      Thread thread = new Thread(r, "event-bus-dispatch-" + threadCounter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    });
    this.retryRegistry = RetryRegistry.of(callbackRetryConfig(settings));
  }

  /** Linear backoff: the wait before attempt n+1 is {@code retryDelay * n}. */
  static RetryConfig callbackRetryConfig(EventBusSettings settings) {
    long delayMs = settings.retryDelay().toMillis();
    IntervalFunction linearBackoff = attempt -> delayMs * attempt;
    return RetryConfig.<HandlerResult>custom()
        .maxAttempts(settings.retryAttempts())
        .intervalFunction(linearBackoff)
        .retryOnResult(result -> !result.success())
        .build();
  }

  public synchronized void connect() {
    if (connected) {
      return;
    }
    try {
      transport.connect();
    } catch (BusConnectionException e) {
      log.error("Failed to connect event bus to broker", e);
      throw e;
    }
    connected = true;
    log.info("Event bus connected");
    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.BUS_CONNECTED, null,
        "Event bus connected", null));
  }

  public synchronized void disconnect() {
    if (!connected) {
      return;
    }
    connected = false;
    subscriptions.keySet().forEach(retryRegistry::remove);
    subscriptions.clear();
    transport.close();
    log.info("Event bus disconnected");
    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.BUS_DISCONNECTED, null,
        "Event bus disconnected", null));
  }

  /** Disconnects and stops the dispatch threads. The bus cannot be reused afterwards. */
  public void shutdown() {
    disconnect();
    dispatchExecutor.shutdown();
    try {
      if (!dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        dispatchExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      dispatchExecutor.shutdownNow();
    }
  }

  public void publish(SystemEvent event) {
    requireConnected();
    String topic = TopicNames.forEvent(event);
    String payload = serialize(event);

    transport.publish(topic, payload);
    transport.publish(TopicNames.ALL, payload);

    if (settings.persistenceEnabled()) {
      persist(event);
    }
    log.debug("Event {} published to topic {}", event.id(), topic);
  }

  public void subscribe(EventSubscription subscription) {
    requireConnected();
    String topic = subscription.topic();
    boolean first;
    synchronized (subscriptions) {
      List<EventSubscription> forTopic =
          subscriptions.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>());
      forTopic.add(subscription);
      first = forTopic.size() == 1;
    }
    if (!first) {
      return;
    }
    try {
      transport.subscribe(topic, payload -> onMessage(topic, payload));
    } catch (RuntimeException e) {
      synchronized (subscriptions) {
        subscriptions.remove(topic);
      }
      log.error("Failed to subscribe to topic {}", topic, e);
      throw e;
    }
    log.info("Subscribed to topic: {}", topic);
  }

  /** Removes {@code handler} from {@code topic}, or every handler when it is null. */
  public void unsubscribe(String topic, EventHandler handler) {
    boolean last;
    synchronized (subscriptions) {
      List<EventSubscription> forTopic = subscriptions.get(topic);
      if (forTopic == null) {
        return;
      }
      if (handler != null) {
        forTopic.removeIf(subscription -> subscription.handler() == handler);
      } else {
        forTopic.clear();
      }
      last = forTopic.isEmpty();
      if (last) {
        subscriptions.remove(topic);
      }
    }
    if (last) {
      retryRegistry.remove(topic);
      transport.unsubscribe(topic);
      log.info("Unsubscribed from topic: {}", topic);
    }
  }

  public void unsubscribe(String topic) {
    unsubscribe(topic, null);
  }

  public List<SystemEvent> getEventHistory(Instant start, Instant end) {
    return getEventHistory(start, end, DEFAULT_HISTORY_LIMIT);
  }

  /**
   * Persisted events with timestamps in {@code [start, end]} in ascending order, keeping
   * the most recent {@code limit}. Null bounds are open.
   */
  public List<SystemEvent> getEventHistory(Instant start, Instant end, int limit) {
    requireConnected();
    double min = start != null ? start.toEpochMilli() : 0;
    double max = end != null ? end.toEpochMilli() : Long.MAX_VALUE;

    List<SystemEvent> events = new ArrayList<>();
    for (String eventId : transport.rangeByScore(TopicNames.TIMELINE, min, max, limit)) {
      try {
        transport.fetch(TopicNames.eventKey(eventId))
            .map(this::deserialize)
            .ifPresent(events::add);
      } catch (RuntimeException e) {
        log.warn("Failed to retrieve event {}", eventId, e);
      }
    }
    return events;
  }

  /**
   * Re-publishes persisted events as {@code replay-{id}} copies, either raw to
   * {@code targetTopic} or through normal topic routing when it is null. Subscribers see
   * replayed events exactly like live ones.
   *
   * @return number of events replayed
   */
  public int replayEvents(Instant start, Instant end, String targetTopic) {
    requireConnected();
    List<SystemEvent> history = getEventHistory(start, end, REPLAY_LIMIT);
    int replayed = 0;
    for (SystemEvent event : history) {
      try {
        Map<String, Object> replayData = new LinkedHashMap<>();
        replayData.put("originalEventId", event.id());
        replayData.put("replayedAt", clock.instant().toString());
        SystemEvent replay = event.readdressed("replay-" + event.id(), event.source(), replayData);

        if (targetTopic != null && !targetTopic.isBlank()) {
          transport.publish(targetTopic, serialize(replay));
        } else {
          publish(replay);
        }
        replayed++;
      } catch (RuntimeException e) {
        log.error("Failed to replay event {}", event.id(), e);
      }
    }
    log.info("Replayed {} events", replayed);
    return replayed;
  }

  public int getSubscriptionCount(String topic) {
    if (topic != null) {
      List<EventSubscription> forTopic = subscriptions.get(topic);
      return forTopic != null ? forTopic.size() : 0;
    }
    return subscriptions.values().stream().mapToInt(List::size).sum();
  }

  public boolean isSubscribed(String topic, EventHandler handler) {
    List<EventSubscription> forTopic = subscriptions.get(topic);
    return forTopic != null && forTopic.stream().anyMatch(subscription -> subscription.handler() == handler);
  }

  public List<String> getTopics() {
    return new ArrayList<>(subscriptions.keySet());
  }

  public boolean isConnected() {
    return connected;
  }

  public boolean isHealthy() {
    return connected && transport.isPublisherReady() && transport.isSubscriberReady();
  }

  void onMessage(String topic, String payload) {
    SystemEvent event;
    try {
      event = deserialize(payload);
    } catch (RuntimeException e) {
      log.error("Error processing event on topic {}", topic, e);
      return;
    }
    dispatch(topic, event);
  }

  /** Completes once every subscriber has either handled the event or given up on it. */
  CompletableFuture<Void> dispatch(String topic, SystemEvent event) {
    List<EventSubscription> forTopic = subscriptions.getOrDefault(topic, List.of());
    List<CompletableFuture<Void>> deliveries = new ArrayList<>(forTopic.size());
    for (EventSubscription subscription : forTopic) {
      CompletableFuture<Void> delivery = CompletableFuture
          .supplyAsync(() -> subscription.accepts(event), dispatchExecutor)
          .thenCompose(accepted -> accepted ? deliver(subscription, event) : CompletableFuture.<Void>completedFuture(null))
          .handle((ignored, error) -> {
            if (error != null) {
              reportFailure(topic, event, error);
            }
            return null;
          });
      deliveries.add(delivery);
    }
    return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]));
  }

  private CompletableFuture<Void> deliver(EventSubscription subscription, SystemEvent event) {
    Retry retry = retryRegistry.retry(subscription.topic());
    AtomicInteger attempts = new AtomicInteger();
    return retry
        .executeCompletionStage(dispatchExecutor, () -> CompletableFuture.supplyAsync(() -> {
          int attempt = attempts.incrementAndGet();
          HandlerResult result = invoke(subscription, event);
          if (!result.success()) {
            log.warn("Callback attempt {} failed on topic {} for event {}: {}",
                attempt, subscription.topic(), event.id(), result.message());
          }
          return result;
        }, dispatchExecutor))
        .toCompletableFuture()
        .thenCompose(result -> result.success()
            ? CompletableFuture.<Void>completedFuture(null)
            : CompletableFuture.<Void>failedFuture(new SubscriptionCallbackException(
                subscription.topic(), event, attempts.get(), result.asThrowable())));
  }

  private HandlerResult invoke(EventSubscription subscription, SystemEvent event) {
    try {
      HandlerResult result = subscription.handler().handle(event);
      return result != null ? result : HandlerResult.ok();
    } catch (Exception e) {
      return HandlerResult.failed(e);
    }
  }

  private void reportFailure(String topic, SystemEvent event, Throwable error) {
    Throwable failure = error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
    Throwable rootCause = failure instanceof SubscriptionCallbackException && failure.getCause() != null
        ? failure.getCause()
        : failure;
    log.error("Error in subscription callback for topic {}", topic, failure);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("topic", topic);
    details.put("eventId", event.id());
    details.put("error", String.valueOf(rootCause.getMessage()));
    notifications.notify(CoordinationNotice.of(clock.instant(),
        NoticeType.SUBSCRIPTION_ERROR, event.id(), failure.getMessage(), details));
  }

  private void persist(SystemEvent event) {
    try {
      Instant now = clock.instant();
      ObjectNode stored = objectMapper.valueToTree(event);
      stored.put("persistedAt", now.toString());
      Instant timestamp = event.timestamp() != null ? event.timestamp() : now;

      transport.store(TopicNames.eventKey(event.id()), objectMapper.writeValueAsString(stored),
          settings.retention());
      transport.index(TopicNames.TIMELINE, event.id(), timestamp.toEpochMilli());
      transport.trimIndex(TopicNames.TIMELINE, now.minus(settings.retention()).toEpochMilli());
    } catch (JsonProcessingException | RuntimeException e) {
      // Losing replay history must not block live delivery.
      log.error("Failed to persist event {}", event.id(), e);
    }
  }

  private String serialize(SystemEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize event " + event.id(), e);
    }
  }

  private SystemEvent deserialize(String payload) {
    try {
      return objectMapper.readValue(payload, SystemEvent.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed event payload", e);
    }
  }

  private void requireConnected() {
    if (!connected) {
      throw new NotConnectedException();
    }
  }
}
