package io.kvchain.api.client;

import java.io.Serializable;

@FunctionalInterface
public interface CacheEntryProcessor<K, V, T> extends Serializable {
   T process(MutableEntry<K, V> entry);
}
