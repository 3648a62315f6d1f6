package io.kvchain.api.client;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a single cache. Read-style operations return the found entries as a map: a miss
 * is an empty map, never a <code>null</code> value stored under the key.
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
public interface CacheApi<K, V> {

   String name();

   Map<K, V> get(K key);

   CompletableFuture<Map<K, V>> getAsync(K key);

   Map<K, V> getAll(Set<K> keys);

   CompletableFuture<Map<K, V>> getAllAsync(Set<K> keys);

   void put(K key, V value);

   CompletableFuture<Void> putAsync(K key, V value);

   void putAll(Map<K, V> entries);

   CompletableFuture<Void> putAllAsync(Map<K, V> entries);

   /**
    * @return Previous entry for the key, or empty map if there was none.
    */
   Map<K, V> getAndPut(K key, V value);

   CompletableFuture<Map<K, V>> getAndPutAsync(K key, V value);

   /**
    * @return Removed entry, or empty map if there was none.
    */
   Map<K, V> getAndRemove(K key);

   CompletableFuture<Map<K, V>> getAndRemoveAsync(K key);

   void remove(K key);

   CompletableFuture<Void> removeAsync(K key);

   void removeAll(Set<K> keys);

   CompletableFuture<Void> removeAllAsync(Set<K> keys);

   /**
    * Runs the processor against the entry atomically.
    *
    * @return Processor result keyed by the key, or empty map if the processor returned <code>null</code>.
    */
   <T> Map<K, T> invoke(K key, CacheEntryProcessor<K, V, T> processor);

   <T> CompletableFuture<Map<K, T>> invokeAsync(K key, CacheEntryProcessor<K, V, T> processor);

   /**
    * Acquires an explicit lock on the key. There is no async variant.
    */
   CacheLock lock(K key);

   CacheApi<K, V> withKeepBinary();

   boolean isKeepBinary();

   /**
    * @return View of this cache whose operations take part in the given transaction.
    */
   CacheApi<K, V> inTransaction(TransactionApi transaction);
}
