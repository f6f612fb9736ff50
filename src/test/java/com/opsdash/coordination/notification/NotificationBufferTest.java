package com.opsdash.coordination.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.coordination.enums.NoticeType;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationBufferTest {

  private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

  private final NotificationBuffer buffer = new NotificationBuffer(new ObjectMapper().findAndRegisterModules(), 3);

  @Test
  void keepsNewestNoticesUpToCapacity() {
    for (int i = 1; i <= 5; i++) {
      buffer.push(CoordinationNotice.of(AT, NoticeType.AGENT_REGISTERED, "agent-" + i, "registered", null));
    }

    assertThat(buffer.getRecent(null, 10))
        .extracting(CoordinationNotice::subjectId)
        .containsExactly("agent-5", "agent-4", "agent-3");
  }

  @Test
  void filtersByTypeAndLimit() {
    buffer.push(CoordinationNotice.of(AT, NoticeType.AGENT_UNHEALTHY, "tf-1", "stale", null));
    buffer.push(CoordinationNotice.of(AT, NoticeType.APPROVAL_REQUESTED, "act-1", "approval", Map.of("policyName", "p")));
    buffer.push(CoordinationNotice.of(AT, NoticeType.AGENT_UNHEALTHY, "tf-2", "stale", null));

    assertThat(buffer.getRecent(Set.of(NoticeType.AGENT_UNHEALTHY), 10))
        .extracting(CoordinationNotice::subjectId)
        .containsExactly("tf-2", "tf-1");
    assertThat(buffer.getRecent(Set.of(), 1)).singleElement()
        .extracting(CoordinationNotice::subjectId)
        .isEqualTo("tf-2");
  }

  @Test
  void streamsRegisterAsListeners() {
    buffer.push(CoordinationNotice.of(AT, NoticeType.BUS_CONNECTED, null, "connected", null));

    buffer.subscribe(Set.of(NoticeType.AGENT_STATUS_CHANGED), 5);
    buffer.subscribe(null, 0);
    buffer.push(CoordinationNotice.of(AT, NoticeType.AGENT_STATUS_CHANGED, "tf-1", "running", null));

    assertThat(buffer.listenerCount()).isEqualTo(2);
  }

  @Test
  void eventNamesFollowNoticeType() {
    assertThat(NotificationBuffer.eventName(NoticeType.AGENT_STATUS_CHANGED)).isEqualTo("agent-status-changed");
    assertThat(NotificationBuffer.eventName(NoticeType.BUS_CONNECTED)).isEqualTo("bus-connected");
  }
}
