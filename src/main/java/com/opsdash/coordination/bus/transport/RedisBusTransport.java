package com.opsdash.coordination.bus.transport;

import com.opsdash.coordination.exception.BusConnectionException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;

/**
 * Redis-backed transport. Publishing and storage go through a {@link StringRedisTemplate};
 * subscriptions run on a {@link RedisMessageListenerContainer}, which holds its own
 * connection because a subscribed Redis connection cannot issue other commands.
 */
public class RedisBusTransport implements BusTransport {

  private static final Logger log = LoggerFactory.getLogger(RedisBusTransport.class);

  private final RedisConnectionFactory connectionFactory;
  private final StringRedisTemplate redis;
  private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();

  private volatile RedisMessageListenerContainer container;
  private volatile boolean connected;

  public RedisBusTransport(RedisConnectionFactory connectionFactory, StringRedisTemplate redis) {
    this.connectionFactory = connectionFactory;
    this.redis = redis;
  }

  @Override
  public synchronized void connect() {
    if (connected) {
      return;
    }
    try {
      ping();
      RedisMessageListenerContainer subscriber = new RedisMessageListenerContainer();
      subscriber.setConnectionFactory(connectionFactory);
      subscriber.afterPropertiesSet();
      subscriber.start();
      this.container = subscriber;
      this.connected = true;
      log.info("Redis publisher and subscriber connections ready");
    } catch (DataAccessException e) {
      throw new BusConnectionException("Failed to connect to Redis", e);
    }
  }

  @Override
  public synchronized void close() {
    connected = false;
    RedisMessageListenerContainer subscriber = container;
    container = null;
    listeners.clear();
    if (subscriber == null) {
      return;
    }
    try {
      subscriber.stop();
      subscriber.destroy();
    } catch (Exception e) {
      log.error("Error shutting down Redis subscriber container", e);
    }
  }

  @Override
  public boolean isPublisherReady() {
    if (!connected) {
      return false;
    }
    try {
      ping();
      return true;
    } catch (DataAccessException e) {
      log.warn("Redis publisher connection not ready: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public boolean isSubscriberReady() {
    RedisMessageListenerContainer subscriber = container;
    return connected && subscriber != null && subscriber.isRunning();
  }

  @Override
  public long publish(String topic, String payload) {
    Long receivers = redis.convertAndSend(topic, payload);
    return receivers != null ? receivers : 0L;
  }

  @Override
  public void subscribe(String topic, Consumer<String> listener) {
    RedisMessageListenerContainer subscriber = requireContainer();
    MessageListener adapter =
        (message, pattern) -> listener.accept(new String(message.getBody(), StandardCharsets.UTF_8));
    MessageListener previous = listeners.put(topic, adapter);
    if (previous != null) {
      subscriber.removeMessageListener(previous);
    }
    subscriber.addMessageListener(adapter, topicFor(topic));
  }

  @Override
  public void unsubscribe(String topic) {
    MessageListener listener = listeners.remove(topic);
    RedisMessageListenerContainer subscriber = container;
    if (listener != null && subscriber != null) {
      subscriber.removeMessageListener(listener, topicFor(topic));
    }
  }

  @Override
  public void store(String key, String value, Duration ttl) {
    redis.opsForValue().set(key, value, ttl);
  }

  @Override
  public Optional<String> fetch(String key) {
    return Optional.ofNullable(redis.opsForValue().get(key));
  }

  @Override
  public void index(String indexKey, String member, double score) {
    redis.opsForZSet().add(indexKey, member, score);
  }

  @Override
  public List<String> rangeByScore(String indexKey, double min, double max, int limit) {
    Set<String> newestFirst = redis.opsForZSet().reverseRangeByScore(indexKey, min, max, 0, limit);
    if (newestFirst == null || newestFirst.isEmpty()) {
      return List.of();
    }
    List<String> ascending = new ArrayList<>(newestFirst);
    Collections.reverse(ascending);
    return ascending;
  }

  @Override
  public void trimIndex(String indexKey, double maxExclusive) {
    redis.opsForZSet().removeRangeByScore(indexKey, 0, Math.nextDown(maxExclusive));
  }

  private void ping() {
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.ping();
    }
  }

  private RedisMessageListenerContainer requireContainer() {
    RedisMessageListenerContainer subscriber = container;
    if (subscriber == null) {
      throw new IllegalStateException("Redis subscriber container is not running");
    }
    return subscriber;
  }

  private static Topic topicFor(String topic) {
    return BusTransport.isPattern(topic) ? new PatternTopic(topic) : new ChannelTopic(topic);
  }
}
