package io.kvchain.api.session;

import java.util.Objects;

/**
 * Result of an {@link Action}: either the session to continue with, or a failure.
 * A failed outcome still carries the session the chain should keep (e.g. with a closed
 * transaction removed).
 */
public final class Outcome {
   private final Session session;
   private final FailureType failureType;
   private final String failure;

   private Outcome(Session session, FailureType failureType, String failure) {
      this.session = Objects.requireNonNull(session);
      this.failureType = failureType;
      this.failure = failure;
   }

   public static Outcome proceed(Session session) {
      return new Outcome(session, null, null);
   }

   public static Outcome fail(Session session, FailureType type, String reason) {
      return new Outcome(session, Objects.requireNonNull(type), Objects.requireNonNull(reason));
   }

   public boolean isFailed() {
      return failureType != null;
   }

   public Session session() {
      return session;
   }

   public FailureType failureType() {
      return failureType;
   }

   public String failure() {
      return failure;
   }

   @Override
   public String toString() {
      return isFailed() ? "Fail(" + failureType + ": " + failure + ")" : "Continue";
   }

   public enum FailureType {
      /**
       * Parameters could not be resolved; the operation was not attempted.
       */
      RESOLUTION,
      /**
       * The cache or transaction operation failed.
       */
      OPERATION,
      /**
       * The operation succeeded but the result did not pass the checks.
       */
      CHECK,
      /**
       * The chain was cancelled while the action was running.
       */
      CANCELLED
   }
}
