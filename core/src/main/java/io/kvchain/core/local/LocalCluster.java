package io.kvchain.core.local;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.client.CacheConfiguration;
import io.kvchain.api.client.ClientException;
import io.kvchain.internal.Properties;
import io.netty.util.concurrent.DefaultThreadFactory;

/**
 * Named in-process cluster of caches. Clusters live until {@link #destroy(String)} is called.
 */
public class LocalCluster {
   private static final Logger log = LogManager.getLogger(LocalCluster.class);
   private static final Map<String, LocalCluster> CLUSTERS = new ConcurrentHashMap<>();
   private static final ExecutorService ASYNC_EXECUTOR = Executors.newFixedThreadPool(
         Properties.getInt(Properties.LOCAL_ASYNC_THREADS, 4), new DefaultThreadFactory("kvchain-local", true));

   private final String name;
   private final Map<String, LocalStore> caches = new ConcurrentHashMap<>();
   private final long lockTimeout;

   LocalCluster(String name, long lockTimeout) {
      this.name = name;
      this.lockTimeout = lockTimeout;
   }

   public static LocalCluster named(String name) {
      return CLUSTERS.computeIfAbsent(name, n -> {
         log.debug("Creating local cluster {}", n);
         return new LocalCluster(n, Properties.getLong(Properties.LOCAL_LOCK_TIMEOUT, 5000));
      });
   }

   public static void destroy(String name) {
      if (CLUSTERS.remove(name) != null) {
         log.debug("Destroyed local cluster {}", name);
      }
   }

   public String name() {
      return name;
   }

   public LocalClient connect() {
      return new LocalClient(this, true);
   }

   public LocalStore getOrCreate(CacheConfiguration configuration) {
      return caches.computeIfAbsent(configuration.name(), n -> {
         log.debug("Creating cache {} in cluster {}", configuration, name);
         return new LocalStore(configuration);
      });
   }

   LocalStore store(String cacheName) {
      LocalStore store = caches.get(cacheName);
      if (store == null) {
         throw new ClientException(String.format("Cache '%s' is not a defined cache", cacheName));
      }
      return store;
   }

   /**
    * @param cacheName Cache name.
    * @return Snapshot of the committed content of the cache.
    */
   public Map<Object, Object> content(String cacheName) {
      return Map.copyOf(store(cacheName).data());
   }

   ExecutorService asyncExecutor() {
      return ASYNC_EXECUTOR;
   }

   long lockTimeout() {
      return lockTimeout;
   }
}
