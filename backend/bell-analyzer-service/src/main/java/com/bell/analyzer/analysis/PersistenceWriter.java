package com.bell.analyzer.analysis;

import com.bell.analyzer.storage.MetricStore;
import com.bell.protocol.Datapoint;
import com.bell.protocol.storage.StorageLayout;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Stores an analyzed datapoint: the sample (replacing any earlier one at the same time), the
 * pruning of samples past the expiration horizon and the metric's new trend. The three writes
 * go out concurrently and are not atomic together. A {@code NaN} multiple is stored as is.
 */
public class PersistenceWriter {

  private final MetricStore store;
  private final StorageLayout layout;
  private final long expiration;
  private final Executor storagePool;

  public PersistenceWriter(MetricStore store, StorageLayout layout, long expiration, Executor storagePool) {
    this.store = store;
    this.layout = layout;
    this.expiration = expiration;
    this.storagePool = storagePool;
  }

  /** Completes with the sample's member key, or with the first write failure. */
  public CompletableFuture<String> save(Datapoint dp, double trend) {
    String name = dp.name();
    long time = dp.time();
    String zset = layout.seriesKey(name);
    String key = StorageLayout.sampleMember(dp);
    String trendValue = StorageLayout.trendPayload(trend, time);

    CompletableFuture<Void> add =
        CompletableFuture.runAsync(() -> store.replace(zset, key, time), storagePool);
    CompletableFuture<Void> prune =
        CompletableFuture.runAsync(() -> store.deleteRange(zset, 0, time - expiration), storagePool);
    CompletableFuture<Void> trendWrite =
        CompletableFuture.runAsync(() -> store.set(layout.trendKey(), name, trendValue), storagePool);

    return CompletableFuture.allOf(add, prune, trendWrite).thenApply(v -> key);
  }
}
