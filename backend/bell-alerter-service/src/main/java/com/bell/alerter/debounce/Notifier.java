package com.bell.alerter.debounce;

/** Delivers a notification somewhere humans look. Must not block the caller for long. */
public interface Notifier {

  void publish(Notification notification);
}
