package com.opsdash.coordination.controller;

import com.opsdash.coordination.bus.EventBus;
import com.opsdash.coordination.enums.EventType;
import com.opsdash.coordination.enums.Severity;
import com.opsdash.coordination.model.SystemEvent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/events")
@Validated
public class EventController {

  private final EventBus eventBus;
  private final Clock clock;

  public EventController(EventBus eventBus, Clock clock) {
    this.eventBus = eventBus;
    this.clock = clock;
  }

  @PostMapping
  public ResponseEntity<EventResponse> publish(@Valid @RequestBody PublishEventRequest request) {
    SystemEvent event = new SystemEvent(
        UUID.randomUUID().toString(),
        request.type(),
        request.source(),
        request.severity() != null ? request.severity() : Severity.LOW,
        request.data(),
        clock.instant(),
        request.correlationId()
    );
    eventBus.publish(event);
    return ResponseEntity
        .status(HttpStatus.ACCEPTED)
        .body(new EventResponse(event.id()));
  }

  @GetMapping("/history")
  public ResponseEntity<List<SystemEvent>> history(
      @RequestParam(value = "start", required = false)
      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
      @RequestParam(value = "end", required = false)
      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
      @RequestParam(value = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
    return ResponseEntity.ok(eventBus.getEventHistory(start, end, limit));
  }

  @PostMapping("/replay")
  public ResponseEntity<ReplayResponse> replay(@Valid @RequestBody ReplayRequest request) {
    int replayed = eventBus.replayEvents(request.start(), request.end(), request.targetTopic());
    return ResponseEntity.ok(new ReplayResponse(replayed));
  }

  public record PublishEventRequest(
      @NotNull EventType type,
      String source,
      Severity severity,
      Map<String, Object> data,
      String correlationId
  ) {}

  public record EventResponse(String eventId) {}

  public record ReplayRequest(@NotNull Instant start, @NotNull Instant end, String targetTopic) {}

  public record ReplayResponse(int replayed) {}
}
