package io.kvchain.core.statistics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import io.kvchain.api.session.Outcome;
import io.kvchain.api.statistics.RequestRecorder;
import io.kvchain.api.statistics.Statistics;
import io.kvchain.api.statistics.StatisticsSnapshot;

/**
 * Records statistics per request name.
 */
public class StatisticsCollector implements RequestRecorder {
   private final Map<String, Statistics> statistics = new ConcurrentHashMap<>();

   @Override
   public void record(String requestName, long startTimestampMillis, long responseTimeNanos, Outcome.FailureType failureType, String message) {
      long endTimestampMillis = startTimestampMillis + TimeUnit.NANOSECONDS.toMillis(responseTimeNanos);
      statistics.computeIfAbsent(requestName, name -> new Statistics())
            .record(startTimestampMillis, endTimestampMillis, responseTimeNanos, failureType);
   }

   /**
    * @return Snapshots sorted by request name.
    */
   public Map<String, StatisticsSnapshot> snapshot() {
      Map<String, StatisticsSnapshot> snapshots = new TreeMap<>();
      statistics.forEach((name, stats) -> snapshots.put(name, stats.snapshot()));
      return snapshots;
   }

   public StatisticsSnapshot total() {
      StatisticsSnapshot total = new StatisticsSnapshot();
      statistics.values().forEach(stats -> total.add(stats.snapshot()));
      return total;
   }

   public void reset() {
      statistics.clear();
   }
}
