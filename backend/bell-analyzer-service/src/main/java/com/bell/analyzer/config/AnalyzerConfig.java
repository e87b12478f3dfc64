package com.bell.analyzer.config;

import com.bell.analyzer.analysis.AnomalyDetector;
import com.bell.protocol.AnomalyEventCodec;
import com.bell.protocol.storage.StorageLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyzerConfig {

  @Bean
  public AnalyzerSettings analyzerSettings(
      @Value("${bell.interval:10}") long interval,
      @Value("${bell.analyzer.filter-offset:0.01}") double filterOffset,
      @Value("${bell.analyzer.periodicity:86400}") long periodicity,
      @Value("${bell.analyzer.expiration:604800}") long expiration,
      @Value("${bell.analyzer.trending-factor:0.1}") double trendingFactor,
      @Value("${bell.analyzer.strict:true}") boolean strict,
      @Value("${bell.analyzer.start-size:50}") int startSize,
      @Value("${bell.analyzer.fill-blank-counters:true}") boolean fillBlankCounters,
      @Value("${bell.analyzer.fill-blank-timers:false}") boolean fillBlankTimers,
      @Value("${bell.analyzer.workers:4}") int workers,
      @Value("${bell.analyzer.storage-threads:4}") int storageThreads) {
    return new AnalyzerSettings(interval, filterOffset, periodicity, expiration, trendingFactor,
        strict, startSize, fillBlankCounters, fillBlankTimers, workers, storageThreads);
  }

  @Bean
  public StorageLayout storageLayout(@Value("${bell.storage.prefix:bell.}") String prefix) {
    return new StorageLayout(prefix);
  }

  @Bean
  public AnomalyDetector anomalyDetector(AnalyzerSettings settings) {
    return new AnomalyDetector(settings.strict(), settings.startSize(), settings.trendingFactor());
  }

  @Bean
  public AnomalyEventCodec anomalyEventCodec(ObjectMapper mapper) {
    return new AnomalyEventCodec(mapper);
  }
}
