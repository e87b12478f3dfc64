package com.bell.alerter.config;

import com.bell.alerter.debounce.AlertDebounceEngine;
import com.bell.alerter.hipchat.HipchatNotifier;
import com.bell.alerter.hipchat.HipchatSettings;
import com.bell.protocol.AnomalyEventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class AlerterConfig {

  @Bean
  public AnomalyEventCodec anomalyEventCodec(ObjectMapper mapper) {
    return new AnomalyEventCodec(mapper);
  }

  /** HipChat alerting is opt-in; without it events are only logged. */
  @Configuration
  @ConditionalOnProperty(prefix = "bell.alerter.hipchat", name = "enabled", havingValue = "true")
  static class Hipchat {

    @Bean
    HipchatSettings hipchatSettings(
        @Value("${bell.alerter.hipchat.threshold:3}") int threshold,
        @Value("${bell.alerter.hipchat.room-id}") String roomId,
        @Value("${bell.alerter.hipchat.token}") String token,
        @Value("${bell.alerter.hipchat.weburl:http://localhost:8080}") String weburl,
        @Value("${bell.alerter.hipchat.notify:true}") boolean notifyRoom,
        @Value("${bell.alerter.hipchat.api-url:https://api.hipchat.com/v1/rooms/message}") String apiUrl) {
      return new HipchatSettings(threshold, roomId, token, weburl, notifyRoom, apiUrl);
    }

    // bounded: a full queue rejects, and the notifier drops that notification
    @Bean(destroyMethod = "shutdown")
    ExecutorService hipchatExecutor(@Value("${bell.alerter.hipchat.queue-capacity:100}") int capacity) {
      return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(capacity),
          new DefaultThreadFactory("bell-hipchat", true));
    }

    @Bean
    HipchatNotifier hipchatNotifier(RestClient.Builder http, HipchatSettings settings,
                                    @Qualifier("hipchatExecutor") ExecutorService executor, MeterRegistry metrics) {
      return new HipchatNotifier(http.build(), settings, executor, metrics);
    }

    @Bean
    AlertDebounceEngine alertDebounceEngine(@Value("${bell.interval:10}") long interval,
                                            HipchatSettings settings, HipchatNotifier notifier) {
      return new AlertDebounceEngine(interval, settings.threshold(), notifier);
    }
  }
}
