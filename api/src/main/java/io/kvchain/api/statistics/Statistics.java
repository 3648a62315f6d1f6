package io.kvchain.api.statistics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.session.Outcome;

/**
 * Thread-safe accumulator of the outcomes of one named request.
 */
public class Statistics {
   private static final Logger log = LogManager.getLogger(Statistics.class);

   private final StatisticsSnapshot active = new StatisticsSnapshot();
   private final long maxLatency = active.histogram.getHighestTrackableValue();

   /**
    * @param startTimestamp Wall-clock millis when the action started.
    * @param endTimestamp Wall-clock millis when its outcome was known.
    * @param latency Nanoseconds between start and outcome.
    * @param failureType <code>null</code> for success.
    */
   public synchronized void record(long startTimestamp, long endTimestamp, long latency, Outcome.FailureType failureType) {
      active.requests++;
      active.startTimestamp = Math.min(active.startTimestamp, startTimestamp);
      active.endTimestamp = Math.max(active.endTimestamp, endTimestamp);
      if (failureType == null) {
         active.successes++;
         recordLatency(latency);
         return;
      }
      switch (failureType) {
         case CHECK:
            active.checkFailures++;
            recordLatency(latency);
            break;
         case RESOLUTION:
            active.resolutionFailures++;
            break;
         case OPERATION:
            active.operationFailures++;
            break;
         case CANCELLED:
            active.cancellations++;
            break;
         default:
            throw new IllegalArgumentException("Unknown failure type " + failureType);
      }
   }

   private void recordLatency(long latency) {
      if (latency > maxLatency) {
         log.warn("Latency {} ns exceeds the trackable maximum {} ns", latency, maxLatency);
         latency = maxLatency;
      } else if (latency < 0) {
         log.warn("Latency {} ns is negative", latency);
         latency = 0;
      }
      active.histogram.recordValue(latency);
   }

   public synchronized StatisticsSnapshot snapshot() {
      return active.copy();
   }
}
