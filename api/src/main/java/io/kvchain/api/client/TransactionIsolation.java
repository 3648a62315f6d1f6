package io.kvchain.api.client;

public enum TransactionIsolation {
   READ_COMMITTED,
   REPEATABLE_READ,
   SERIALIZABLE
}
