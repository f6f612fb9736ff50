package com.opsdash.coordination.notification;

import com.opsdash.coordination.enums.NoticeType;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LoggingNotificationService implements NotificationService {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationService.class);

  private static final Set<NoticeType> WARN_LEVEL = EnumSet.of(
      NoticeType.SUBSCRIPTION_ERROR,
      NoticeType.AGENT_UNHEALTHY,
      NoticeType.APPROVAL_EXPIRED
  );

  private final NotificationBuffer buffer;

  public LoggingNotificationService(NotificationBuffer buffer) {
    this.buffer = buffer;
  }

  @Override
  public void notify(CoordinationNotice notice) {
    if (WARN_LEVEL.contains(notice.type())) {
      log.warn("NOTICE {}: subject={}, message={}", notice.type(), notice.subjectId(), notice.message());
    } else if (notice.type() != NoticeType.AGENT_METRICS_UPDATED) {
      log.info("NOTICE {}: subject={}, message={}", notice.type(), notice.subjectId(), notice.message());
    }
    buffer.push(notice);
  }
}
