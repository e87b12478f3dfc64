package com.bell.analyzer.analysis;

import com.bell.analyzer.config.AnalyzerSettings;
import com.bell.analyzer.storage.MetricStore;
import com.bell.protocol.Datapoint;
import com.bell.protocol.storage.StorageLayout;
import com.bell.protocol.storage.StoredSample;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * History is one window per period back to the expiration horizon, each window covering
 * {@code [anchor - span, anchor + span]}.
 */
public class SeriesReconstructor {

  private final MetricStore store;
  private final StorageLayout layout;
  private final AnalyzerSettings settings;
  private final Executor storagePool;

  public SeriesReconstructor(MetricStore store, StorageLayout layout, AnalyzerSettings settings,
                             Executor storagePool) {
    this.store = store;
    this.layout = layout;
    this.settings = settings;
    this.storagePool = storagePool;
  }

  public History query(Datapoint dp) {
    String name = dp.name();
    long time = dp.time();
    double span = settings.span();
    String zset = layout.seriesKey(name);

    CompletableFuture<String> trendRead =
        CompletableFuture.supplyAsync(() -> store.get(layout.trendKey(), name), storagePool);

    // newest anchor first
    List<Window> windows = new ArrayList<>();
    List<CompletableFuture<List<String>>> reads = new ArrayList<>();
    for (long anchor = time; time - anchor < settings.expiration(); anchor -= settings.periodicity()) {
      double start = anchor - span;
      double stop = anchor + span;
      windows.add(new Window(start, stop));
      reads.add(CompletableFuture.supplyAsync(() -> store.rangeQuery(zset, start, stop), storagePool));
    }

    List<CompletableFuture<?>> all = new ArrayList<>(reads);
    all.add(trendRead);
    Futures.await(CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0])));

    List<Chunk> chunks = new ArrayList<>(windows.size());
    for (int i = windows.size() - 1; i >= 0; i--) {
      List<StoredSample> samples = new ArrayList<>();
      for (String member : reads.get(i).join()) {
        samples.add(StorageLayout.parseSample(member));
      }
      chunks.add(new Chunk(windows.get(i).start(), windows.get(i).stop(), samples));
    }

    List<Double> values = rebuild(name, chunks);
    values.add(dp.value());

    double trend = StorageLayout.parseTrend(trendRead.join());
    return new History(trend, values.stream().mapToDouble(Double::doubleValue).toArray());
  }

  // chunks oldest first
  public List<Double> rebuild(String name, List<Chunk> chunks) {
    List<Double> out = new ArrayList<>();
    boolean fill = settings.fillBlanks(name);
    GapFill state = new GapFill();
    for (Chunk chunk : chunks) {
      if (fill) {
        fillBlanks(chunk, state, out);
      } else {
        for (StoredSample s : chunk.samples()) {
          out.add(s.value());
        }
      }
    }
    return out;
  }

  // carry forward the latest sample; an empty step is 0 only after a non-zero value
  private void fillBlanks(Chunk chunk, GapFill state, List<Double> out) {
    List<StoredSample> samples = chunk.samples();
    long step = settings.interval();
    int next = 0;
    boolean seen = false;
    double last = 0;

    for (double t = chunk.start(); t <= chunk.stop(); t += step) {
      while (next < samples.size() && samples.get(next).time() <= t) {
        last = samples.get(next).value();
        seen = true;
        next++;
      }
      if (seen) {
        state.emit(last, out);
      } else if (state.nonZeroSeen) {
        state.emit(0, out);
      }
    }
  }

  public record Chunk(double start, double stop, List<StoredSample> samples) {}

  private record Window(double start, double stop) {}

  private static final class GapFill {
    boolean nonZeroSeen;

    void emit(double value, List<Double> out) {
      out.add(value);
      if (value != 0) nonZeroSeen = true;
    }
  }
}
