package io.kvchain.api.statistics;

import io.kvchain.api.session.Outcome;

/**
 * Receives the outcome and latency of every executed action. Called concurrently from all sessions.
 */
public interface RequestRecorder {
   RequestRecorder NOOP = (requestName, startTimestampMillis, responseTimeNanos, failureType, message) -> {};

   /**
    * @param requestName Name of the action, prefixed with the names of enclosing groups.
    * @param startTimestampMillis Wall-clock time when the action started.
    * @param responseTimeNanos Time until the action's outcome was known.
    * @param failureType <code>null</code> on success.
    * @param message Failure description or <code>null</code>.
    */
   void record(String requestName, long startTimestampMillis, long responseTimeNanos, Outcome.FailureType failureType, String message);
}
