package com.opsdash.coordination.bus.transport;

import com.opsdash.coordination.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class InMemoryBusTransportTest {

  private MutableClock clock;
  private InMemoryBusTransport transport;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    transport = new InMemoryBusTransport(clock);
    transport.connect();
  }

  @AfterEach
  void tearDown() {
    transport.close();
  }

  @Test
  @SuppressWarnings("unchecked")
  void patternSubscriptionReceivesSourceQualifiedTopics() {
    Consumer<String> exact = mock(Consumer.class);
    Consumer<String> pattern = mock(Consumer.class);
    transport.subscribe("events:alert", exact);
    transport.subscribe("events:alert:*", pattern);

    long receivers = transport.publish("events:alert:prometheus", "p1");
    transport.publish("events:alert", "p2");
    transport.publish("events:cost-anomaly:aws", "p3");

    assertThat(receivers).isEqualTo(1);
    verify(pattern, timeout(1000)).accept("p1");
    verify(exact, timeout(1000)).accept("p2");
    verify(pattern, after(100).never()).accept("p2");
    verify(pattern, never()).accept("p3");
    verify(exact, never()).accept("p1");
  }

  @Test
  void storedValuesExpireAfterTtl() {
    transport.store("event:1", "{}", Duration.ofMinutes(10));

    assertThat(transport.fetch("event:1")).contains("{}");

    clock.advance(Duration.ofMinutes(10));
    assertThat(transport.fetch("event:1")).isEmpty();
  }

  @Test
  void rangeByScoreIsAscendingAndKeepsHighestScoresWhenLimited() {
    transport.index("timeline", "c", 30);
    transport.index("timeline", "a", 10);
    transport.index("timeline", "b", 20);
    transport.index("timeline", "d", 40);

    assertThat(transport.rangeByScore("timeline", 0, 100, 10)).containsExactly("a", "b", "c", "d");
    assertThat(transport.rangeByScore("timeline", 0, 100, 2)).containsExactly("c", "d");
    assertThat(transport.rangeByScore("timeline", 15, 35, 10)).containsExactly("b", "c");
  }

  @Test
  void trimIndexDropsScoresBelowBound() {
    transport.index("timeline", "old", 10);
    transport.index("timeline", "new", 20);

    transport.trimIndex("timeline", 20);

    assertThat(transport.rangeByScore("timeline", 0, 100, 10)).containsExactly("new");
  }

  @Test
  void closedTransportRejectsPublishing() {
    transport.close();

    assertThat(transport.isPublisherReady()).isFalse();
    assertThatThrownBy(() -> transport.publish("events:alert", "{}"))
        .isInstanceOf(IllegalStateException.class);
  }
}
