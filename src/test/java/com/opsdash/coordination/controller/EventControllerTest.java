package com.opsdash.coordination.controller;

import com.opsdash.coordination.bus.EventBus;
import com.opsdash.coordination.enums.EventType;
import com.opsdash.coordination.enums.Severity;
import com.opsdash.coordination.exception.NotConnectedException;
import com.opsdash.coordination.model.SystemEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EventController.class)
class EventControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private EventBus eventBus;

  @MockBean
  private Clock clock;

  @Test
  void publishReturns202AndDefaultsSeverity() throws Exception {
    given(clock.instant()).willReturn(NOW);

    mockMvc.perform(
            post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"drift-detected\",\"source\":\"scanner\",\"data\":{\"resource\":\"vpc-main\"}}")
        )
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.eventId").isNotEmpty());

    ArgumentCaptor<SystemEvent> captor = ArgumentCaptor.forClass(SystemEvent.class);
    verify(eventBus).publish(captor.capture());
    SystemEvent published = captor.getValue();
    assertThat(published.type()).isEqualTo(EventType.DRIFT_DETECTED);
    assertThat(published.severity()).isEqualTo(Severity.LOW);
    assertThat(published.timestamp()).isEqualTo(NOW);
    assertThat(published.data()).containsEntry("resource", "vpc-main");
  }

  @Test
  void publishWithoutTypeReturns400() throws Exception {
    mockMvc.perform(
            post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"scanner\"}")
        )
        .andExpect(status().isBadRequest());

    verify(eventBus, never()).publish(any());
  }

  @Test
  void publishWhileDisconnectedReturns503() throws Exception {
    given(clock.instant()).willReturn(NOW);
    willThrow(new NotConnectedException()).given(eventBus).publish(any());

    mockMvc.perform(
            post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"alert\"}")
        )
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("bus_unavailable"));
  }

  @Test
  void historyPassesWindowAndLimit() throws Exception {
    Instant start = Instant.parse("2026-03-01T00:00:00Z");
    Instant end = Instant.parse("2026-03-02T00:00:00Z");
    SystemEvent event = new SystemEvent("e1", EventType.ALERT, "prometheus", Severity.HIGH,
        Map.of("component", "kubernetes"), NOW, null);
    given(eventBus.getEventHistory(start, end, 10)).willReturn(List.of(event));

    mockMvc.perform(get("/api/v1/events/history")
            .param("start", "2026-03-01T00:00:00Z")
            .param("end", "2026-03-02T00:00:00Z")
            .param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("e1"))
        .andExpect(jsonPath("$[0].type").value("alert"))
        .andExpect(jsonPath("$[0].severity").value("high"));
  }

  @Test
  void historyRejectsOversizedLimit() throws Exception {
    mockMvc.perform(get("/api/v1/events/history").param("limit", "5000"))
        .andExpect(status().isBadRequest());

    verify(eventBus, never()).getEventHistory(any(), any(), eq(5000));
  }

  @Test
  void replayReturnsCount() throws Exception {
    given(eventBus.replayEvents(any(), any(), eq("events:replay"))).willReturn(3);

    mockMvc.perform(
            post("/api/v1/events/replay")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start\":\"2026-03-01T00:00:00Z\",\"end\":\"2026-03-02T00:00:00Z\","
                    + "\"targetTopic\":\"events:replay\"}")
        )
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.replayed").value(3));
  }
}
