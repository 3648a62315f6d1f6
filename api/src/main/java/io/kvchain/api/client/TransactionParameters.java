package io.kvchain.api.client;

import java.io.Serializable;

public class TransactionParameters implements Serializable {
   public static final TransactionParameters DEFAULT = new TransactionParameters(
         TransactionConcurrency.PESSIMISTIC, TransactionIsolation.REPEATABLE_READ, 0, 0);

   private final TransactionConcurrency concurrency;
   private final TransactionIsolation isolation;
   private final long timeout;
   private final int size;

   /**
    * @param concurrency Concurrency mode.
    * @param isolation Isolation level.
    * @param timeout Timeout in milliseconds, <code>0</code> for no timeout.
    * @param size Expected number of entries taking part in the transaction, <code>0</code> if unknown.
    */
   public TransactionParameters(TransactionConcurrency concurrency, TransactionIsolation isolation, long timeout, int size) {
      this.concurrency = concurrency;
      this.isolation = isolation;
      this.timeout = timeout;
      this.size = size;
   }

   public TransactionConcurrency concurrency() {
      return concurrency;
   }

   public TransactionIsolation isolation() {
      return isolation;
   }

   public long timeout() {
      return timeout;
   }

   public int size() {
      return size;
   }

   @Override
   public String toString() {
      return concurrency + "/" + isolation + (timeout > 0 ? ", timeout " + timeout + " ms" : "");
   }
}
