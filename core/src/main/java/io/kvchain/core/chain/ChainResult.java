package io.kvchain.core.chain;

import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;

public class ChainResult {
   private final String chainName;
   private final Session session;
   private final Outcome.FailureType failureType;
   private final String failure;
   private final String failedRequest;

   public ChainResult(String chainName, Session session, Outcome.FailureType failureType, String failure, String failedRequest) {
      this.chainName = chainName;
      this.session = session;
      this.failureType = failureType;
      this.failure = failure;
      this.failedRequest = failedRequest;
   }

   public String chainName() {
      return chainName;
   }

   /**
    * @return Session after the last executed action and after releasing leftover resources.
    */
   public Session session() {
      return session;
   }

   public boolean isSuccess() {
      return failureType == null;
   }

   public boolean isCancelled() {
      return failureType == Outcome.FailureType.CANCELLED;
   }

   /**
    * @return Type of the first failure or <code>null</code>.
    */
   public Outcome.FailureType failureType() {
      return failureType;
   }

   public String failure() {
      return failure;
   }

   /**
    * @return Request that failed first or <code>null</code> if the chain succeeded or was cancelled between actions.
    */
   public String failedRequest() {
      return failedRequest;
   }

   @Override
   public String toString() {
      return isSuccess() ? "ChainResult{" + chainName + " #" + session.userId() + ": OK}"
            : "ChainResult{" + chainName + " #" + session.userId() + ": " + failureType + " in " + failedRequest + ": " + failure + "}";
   }
}
