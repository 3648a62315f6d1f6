package io.kvchain.api.statistics;

import java.io.Serializable;
import java.util.concurrent.TimeUnit;

import org.HdrHistogram.Histogram;

/**
 * Non-thread safe mutable counters of executed actions. Latencies of actions whose operation
 * returned (successes and check failures) go into the histogram, in nanoseconds.
 */
public class StatisticsSnapshot implements Serializable {
   public final Histogram histogram = new Histogram(TimeUnit.MINUTES.toNanos(1), 2);
   public long startTimestamp = Long.MAX_VALUE;
   public long endTimestamp = Long.MIN_VALUE;
   public int requests;
   public int successes;
   public int checkFailures;
   public int resolutionFailures;
   public int operationFailures;
   public int cancellations;

   public boolean isEmpty() {
      return requests == 0;
   }

   public void reset() {
      histogram.reset();
      startTimestamp = Long.MAX_VALUE;
      endTimestamp = Long.MIN_VALUE;
      requests = 0;
      successes = 0;
      checkFailures = 0;
      resolutionFailures = 0;
      operationFailures = 0;
      cancellations = 0;
   }

   public StatisticsSnapshot copy() {
      StatisticsSnapshot copy = new StatisticsSnapshot();
      copy.add(this);
      return copy;
   }

   public void add(StatisticsSnapshot other) {
      histogram.add(other.histogram);
      startTimestamp = Math.min(startTimestamp, other.startTimestamp);
      endTimestamp = Math.max(endTimestamp, other.endTimestamp);
      requests += other.requests;
      successes += other.successes;
      checkFailures += other.checkFailures;
      resolutionFailures += other.resolutionFailures;
      operationFailures += other.operationFailures;
      cancellations += other.cancellations;
   }

   public int failures() {
      return checkFailures + resolutionFailures + operationFailures + cancellations;
   }

   public long meanLatency() {
      return histogram.getTotalCount() == 0 ? 0 : (long) histogram.getMean();
   }

   public long maxLatency() {
      return histogram.getMaxValue();
   }

   @Override
   public String toString() {
      return "StatisticsSnapshot{requests=" + requests +
            ", successes=" + successes +
            ", checkFailures=" + checkFailures +
            ", resolutionFailures=" + resolutionFailures +
            ", operationFailures=" + operationFailures +
            ", cancellations=" + cancellations +
            ", meanLatency=" + meanLatency() + " ns}";
   }
}
