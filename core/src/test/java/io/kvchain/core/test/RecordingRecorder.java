package io.kvchain.core.test;

import java.util.ArrayList;
import java.util.List;

import io.kvchain.api.session.Outcome;
import io.kvchain.api.statistics.RequestRecorder;

public class RecordingRecorder implements RequestRecorder {
   private final List<Record> records = new ArrayList<>();

   @Override
   public synchronized void record(String requestName, long startTimestampMillis, long responseTimeNanos, Outcome.FailureType failureType, String message) {
      records.add(new Record(requestName, failureType, message));
   }

   public synchronized List<String> requests() {
      List<String> names = new ArrayList<>();
      records.forEach(r -> names.add(r.requestName));
      return names;
   }

   public synchronized List<Record> records() {
      return new ArrayList<>(records);
   }

   public static class Record {
      public final String requestName;
      public final Outcome.FailureType failureType;
      public final String message;

      Record(String requestName, Outcome.FailureType failureType, String message) {
         this.requestName = requestName;
         this.failureType = failureType;
         this.message = message;
      }

      @Override
      public String toString() {
         return requestName + (failureType == null ? "" : " " + failureType + ": " + message);
      }
   }
}
