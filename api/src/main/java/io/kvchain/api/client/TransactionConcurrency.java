package io.kvchain.api.client;

public enum TransactionConcurrency {
   OPTIMISTIC,
   PESSIMISTIC
}
