package com.opsdash.coordination.bus.transport;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Broker seam used by the event bus. Implementations hold two logical connections:
 * one for publishing and storage commands and a dedicated one for subscriptions.
 *
 * <p>Topics containing {@code *} or {@code ?} are glob patterns.
 */
public interface BusTransport {

  /**
   * Open both connections.
   *
   * @throws com.opsdash.coordination.exception.BusConnectionException if the broker
   *         cannot be reached
   */
  void connect();

  void close();

  boolean isPublisherReady();

  boolean isSubscriberReady();

  /** @return number of broker-side receivers the message reached, when known */
  long publish(String topic, String payload);

  void subscribe(String topic, Consumer<String> listener);

  void unsubscribe(String topic);

  void store(String key, String value, Duration ttl);

  Optional<String> fetch(String key);

  void index(String indexKey, String member, double score);

  /**
   * Members scored within {@code [min, max]}, ascending by score. When {@code limit}
   * cuts the range, the highest-scored members are kept.
   */
  List<String> rangeByScore(String indexKey, double min, double max, int limit);

  /** Drops index members scored strictly below {@code maxExclusive}. */
  void trimIndex(String indexKey, double maxExclusive);

  static boolean isPattern(String topic) {
    return topic.indexOf('*') >= 0 || topic.indexOf('?') >= 0;
  }
}
