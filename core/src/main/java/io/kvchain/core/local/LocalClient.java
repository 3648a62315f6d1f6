package io.kvchain.core.local;

import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.CacheConfiguration;
import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.ClientException;
import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.client.TransactionParameters;

public class LocalClient implements ClientApi {
   private static final Logger log = LogManager.getLogger(LocalClient.class);

   private final LocalCluster cluster;
   private final boolean asyncSupported;
   private volatile boolean closed;

   LocalClient(LocalCluster cluster, boolean asyncSupported) {
      this.cluster = cluster;
      this.asyncSupported = asyncSupported;
   }

   @Override
   public <K, V> CacheApi<K, V> cache(String name) {
      ensureOpen();
      return new LocalCache<>(this, cluster.store(name), false, null);
   }

   @Override
   public <K, V> CacheApi<K, V> getOrCreateCache(CacheConfiguration configuration) {
      ensureOpen();
      return new LocalCache<>(this, cluster.getOrCreate(configuration), false, null);
   }

   @Override
   public <K, V> CompletableFuture<CacheApi<K, V>> getOrCreateCacheAsync(CacheConfiguration configuration) {
      return CompletableFuture.supplyAsync(() -> getOrCreateCache(configuration), cluster.asyncExecutor());
   }

   @Override
   public TransactionApi txStart(TransactionParameters parameters) {
      ensureOpen();
      return new LocalTransaction(cluster, parameters);
   }

   @Override
   public boolean asyncSupported() {
      return asyncSupported;
   }

   LocalCluster cluster() {
      return cluster;
   }

   public boolean isClosed() {
      return closed;
   }

   void ensureOpen() {
      if (closed) {
         throw new ClientException("Client is closed");
      }
   }

   @Override
   public void close() {
      if (!closed) {
         closed = true;
         log.debug("Closed client of cluster {}", cluster.name());
      }
   }
}
