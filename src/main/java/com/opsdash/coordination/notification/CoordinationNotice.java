package com.opsdash.coordination.notification;

import com.opsdash.coordination.enums.NoticeType;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record CoordinationNotice(
    String id,
    Instant timestamp,
    NoticeType type,
    String subjectId,
    String message,
    Map<String, Object> details
) {

  public static CoordinationNotice of(Instant timestamp, NoticeType type, String subjectId, String message,
                                      Map<String, Object> details) {
    return new CoordinationNotice(
        UUID.randomUUID().toString(),
        timestamp,
        type,
        subjectId,
        message,
        details == null ? Map.of() : details
    );
  }
}
