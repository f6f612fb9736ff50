package com.opsdash.coordination.notification;

public interface NotificationService {

  void notify(CoordinationNotice notice);
}
