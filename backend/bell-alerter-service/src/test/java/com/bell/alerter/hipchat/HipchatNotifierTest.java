package com.bell.alerter.hipchat;

import com.bell.alerter.debounce.Notification;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HipchatNotifierTest {

  private static final HipchatSettings SETTINGS = new HipchatSettings(
      3, "1234", "t0k3n", "http://bell.local", true, "https://api.hipchat.com/v1/rooms/message");
  private static final String API = "https://api.hipchat.com/v1/rooms/message?format=json&auth_token=t0k3n";

  private MockRestServiceServer server;
  private SimpleMeterRegistry metrics;
  private HipchatNotifier notifier;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    metrics = new SimpleMeterRegistry();
    notifier = new HipchatNotifier(builder.build(), SETTINGS, Runnable::run, metrics);
  }

  @Test
  void messageLinksTheMetricAndShowsTheDirection() {
    assertEquals("trending ↑, <a href=\"http://bell.local/?pattern=timer.api&limit=1\">timer.api</a> (3 anomalies)",
        HipchatNotifier.message(new Notification("timer.api", 3, 0.25), "http://bell.local"));
    assertEquals("trending ↓, <a href=\"w/?pattern=m&limit=1\">m</a> (7 anomalies)",
        HipchatNotifier.message(new Notification("m", 7, -0.1), "w"));
    assertTrue(HipchatNotifier.message(new Notification("m", 1, 0), "w").startsWith("trending ↓"));
  }

  @Test
  void postsTheRoomMessageForm() {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("room_id", "1234");
    form.add("from", "Bell Alerter");
    form.add("message", "trending ↑, <a href=\"http://bell.local/?pattern=timer.api&limit=1\">timer.api</a> (4 anomalies)");
    form.add("notify", "1");
    server.expect(requestTo(API))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(content().formData(form))
        .andRespond(withSuccess("{\"status\":\"sent\"}", MediaType.APPLICATION_JSON));

    notifier.publish(new Notification("timer.api", 4, 0.3));

    server.verify();
    assertEquals(1.0, metrics.counter("bell_alerter_notifications_sent_total").count());
  }

  @Test
  void failedRequestIsCountedNotThrown() {
    server.expect(requestTo(API)).andRespond(withServerError());

    assertDoesNotThrow(() -> notifier.publish(new Notification("m", 3, 1)));

    server.verify();
    assertEquals(1.0, metrics.counter("bell_alerter_notifications_failed_total").count());
    assertEquals(0.0, metrics.counter("bell_alerter_notifications_sent_total").count());
  }

  @Test
  void fullBacklogDropsTheNotification() {
    Executor full = task -> {
      throw new RejectedExecutionException("queue full");
    };
    HipchatNotifier backlogged = new HipchatNotifier(RestClient.builder().build(), SETTINGS, full, metrics);

    assertDoesNotThrow(() -> backlogged.publish(new Notification("m", 3, 1)));

    assertEquals(1.0, metrics.counter("bell_alerter_notifications_failed_total").count());
  }
}
