package com.bell.alerter.hipchat;

import com.bell.alerter.debounce.Notification;
import com.bell.alerter.debounce.Notifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/** Posts a room message through the HipChat v1 API. Requests run on {@code executor}. */
public class HipchatNotifier implements Notifier {

  private static final Logger log = LoggerFactory.getLogger(HipchatNotifier.class);

  static final String FROM = "Bell Alerter";
  private static final String PATTERN = "trending %s, <a href=\"%s/?pattern=%s&limit=1\">%s</a> (%d anomalies)";

  private final RestClient http;
  private final HipchatSettings settings;
  private final Executor executor;
  private final Counter sent;
  private final Counter failed;

  public HipchatNotifier(RestClient http, HipchatSettings settings, Executor executor, MeterRegistry metrics) {
    this.http = http;
    this.settings = settings;
    this.executor = executor;
    this.sent = metrics.counter("bell_alerter_notifications_sent_total");
    this.failed = metrics.counter("bell_alerter_notifications_failed_total");
  }

  @Override
  public void publish(Notification notification) {
    log.info("Notify hipchat.., {} {} {}", notification.name(), notification.count(), notification.trend());
    try {
      executor.execute(() -> deliver(notification));
    } catch (RejectedExecutionException e) {
      failed.increment();
      log.warn("Hipchat backlog full, dropping notification for {}", notification.name());
    }
  }

  void deliver(Notification notification) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("room_id", settings.roomId());
    form.add("from", FROM);
    form.add("message", message(notification, settings.weburl()));
    form.add("notify", settings.notifyRoom() ? "1" : "0");
    try {
      http.post()
          .uri(settings.apiUrl() + "?format=json&auth_token={token}", settings.token())
          .contentType(MediaType.APPLICATION_FORM_URLENCODED)
          .body(form)
          .retrieve()
          .toBodilessEntity();
      sent.increment();
    } catch (RestClientException e) {
      failed.increment();
      log.error("Hipchat request error: {}", e.getMessage());
    }
  }

  static String message(Notification notification, String weburl) {
    String arrow = notification.trend() > 0 ? "↑" : "↓";
    return String.format(PATTERN, arrow, weburl, notification.name(), notification.name(), notification.count());
  }
}
