package io.kvchain.api.client;

public enum CacheMode {
   PARTITIONED,
   REPLICATED
}
