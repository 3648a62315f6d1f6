package io.kvchain.api.client;

public enum CacheAtomicity {
   ATOMIC,
   TRANSACTIONAL
}
