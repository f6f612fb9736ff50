package com.opsdash.coordination.bus.transport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-process stand-in for the broker, used for local runs and tests. Messages are
 * delivered asynchronously on one thread, so per-topic publish order is preserved.
 */
public class InMemoryBusTransport implements BusTransport {

  private static final Logger log = LoggerFactory.getLogger(InMemoryBusTransport.class);

  private final Clock clock;
  private final Map<String, Consumer<String>> listeners = new ConcurrentHashMap<>();
  private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();
  private final Map<String, StoredValue> values = new ConcurrentHashMap<>();
  private final Map<String, Map<String, Double>> indexes = new HashMap<>();

  private volatile ExecutorService delivery;
  private volatile boolean ready;

  public InMemoryBusTransport() {
    this(Clock.systemUTC());
  }

  public InMemoryBusTransport(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized void connect() {
    if (ready) {
      return;
    }
    delivery = Executors.newSingleThreadExecutor(r -> {
      Thread thread = new Thread(r, "memory-bus-delivery");
      thread.setDaemon(true);
      return thread;
    });
    ready = true;
    log.info("In-memory bus transport ready");
  }

  @Override
  public synchronized void close() {
    ready = false;
    if (delivery != null) {
      delivery.shutdown();
      delivery = null;
    }
    listeners.clear();
    patterns.clear();
  }

  @Override
  public boolean isPublisherReady() {
    return ready;
  }

  @Override
  public boolean isSubscriberReady() {
    return ready;
  }

  @Override
  public long publish(String topic, String payload) {
    requireReady();
    List<Consumer<String>> receivers = new ArrayList<>();
    listeners.forEach((subscribed, listener) -> {
      if (matches(subscribed, topic)) {
        receivers.add(listener);
      }
    });
    for (Consumer<String> receiver : receivers) {
      delivery.execute(() -> {
        try {
          receiver.accept(payload);
        } catch (RuntimeException e) {
          log.error("Listener failed on topic {}", topic, e);
        }
      });
    }
    return receivers.size();
  }

  @Override
  public void subscribe(String topic, Consumer<String> listener) {
    requireReady();
    if (BusTransport.isPattern(topic)) {
      patterns.put(topic, globToRegex(topic));
    }
    listeners.put(topic, listener);
  }

  @Override
  public void unsubscribe(String topic) {
    listeners.remove(topic);
    patterns.remove(topic);
  }

  @Override
  public void store(String key, String value, Duration ttl) {
    requireReady();
    values.put(key, new StoredValue(value, clock.instant().plus(ttl)));
  }

  @Override
  public Optional<String> fetch(String key) {
    requireReady();
    StoredValue stored = values.get(key);
    if (stored == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(stored.expiresAt())) {
      values.remove(key, stored);
      return Optional.empty();
    }
    return Optional.of(stored.value());
  }

  @Override
  public synchronized void index(String indexKey, String member, double score) {
    requireReady();
    indexes.computeIfAbsent(indexKey, k -> new HashMap<>()).put(member, score);
  }

  @Override
  public synchronized List<String> rangeByScore(String indexKey, double min, double max, int limit) {
    requireReady();
    Map<String, Double> index = indexes.getOrDefault(indexKey, Map.of());
    List<Map.Entry<String, Double>> inRange = new ArrayList<>();
    for (Map.Entry<String, Double> entry : index.entrySet()) {
      if (entry.getValue() >= min && entry.getValue() <= max) {
        inRange.add(entry);
      }
    }
    inRange.sort(Map.Entry.<String, Double>comparingByValue()
        .thenComparing(Map.Entry.comparingByKey(Comparator.naturalOrder())));
    int from = Math.max(0, inRange.size() - Math.max(limit, 0));
    return inRange.subList(from, inRange.size()).stream().map(Map.Entry::getKey).toList();
  }

  @Override
  public synchronized void trimIndex(String indexKey, double maxExclusive) {
    Map<String, Double> index = indexes.get(indexKey);
    if (index != null) {
      index.values().removeIf(score -> score < maxExclusive);
    }
  }

  private boolean matches(String subscribed, String topic) {
    Pattern pattern = patterns.get(subscribed);
    return pattern != null ? pattern.matcher(topic).matches() : subscribed.equals(topic);
  }

  private void requireReady() {
    if (!ready) {
      throw new IllegalStateException("In-memory transport is closed");
    }
  }

  static Pattern globToRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    for (char c : glob.toCharArray()) {
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString());
  }

  private record StoredValue(String value, Instant expiresAt) {}
}
