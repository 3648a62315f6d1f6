package io.kvchain.api.client;

import java.util.concurrent.CompletableFuture;

/**
 * Top-level handle to the cache cluster. A single instance may be shared by many sessions
 * and must be safe for concurrent use.
 */
public interface ClientApi extends AutoCloseable {

   /**
    * Looks up an existing cache.
    *
    * @param name Cache name.
    * @param <K> Key type.
    * @param <V> Value type.
    * @return Cache handle.
    * @throws ClientException if the cache does not exist or cannot be accessed.
    */
   <K, V> CacheApi<K, V> cache(String name);

   <K, V> CacheApi<K, V> getOrCreateCache(CacheConfiguration configuration);

   <K, V> CompletableFuture<CacheApi<K, V>> getOrCreateCacheAsync(CacheConfiguration configuration);

   /**
    * Starts a new transaction. The transaction is not bound to the calling thread; operations take part
    * in it only through {@link CacheApi#inTransaction(TransactionApi)}.
    *
    * @param parameters Concurrency, isolation, timeout and size of the transaction.
    * @return Transaction handle.
    */
   TransactionApi txStart(TransactionParameters parameters);

   /**
    * @return True if the <code>*Async</code> variants of operations complete without blocking the caller.
    */
   default boolean asyncSupported() {
      return true;
   }

   @Override
   void close();
}
