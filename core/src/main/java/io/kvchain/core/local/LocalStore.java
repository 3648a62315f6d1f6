package io.kvchain.core.local;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import io.kvchain.api.client.CacheConfiguration;
import io.kvchain.api.client.ClientException;

/**
 * Committed content of a single cache and its key locks.
 */
class LocalStore {
   private final CacheConfiguration configuration;
   private final ConcurrentHashMap<Object, Object> data = new ConcurrentHashMap<>();
   private final ConcurrentHashMap<Object, Semaphore> locks = new ConcurrentHashMap<>();

   LocalStore(CacheConfiguration configuration) {
      this.configuration = configuration;
   }

   String name() {
      return configuration.name();
   }

   CacheConfiguration configuration() {
      return configuration;
   }

   ConcurrentHashMap<Object, Object> data() {
      return data;
   }

   void apply(Map<Object, Object> writes, Object removed) {
      writes.forEach((key, value) -> {
         if (value == removed) {
            data.remove(key);
         } else {
            data.put(key, value);
         }
      });
   }

   LocalLock lock(Object key, long timeoutMillis) {
      Semaphore semaphore = locks.computeIfAbsent(key, k -> new Semaphore(1));
      try {
         if (!semaphore.tryAcquire(timeoutMillis, TimeUnit.MILLISECONDS)) {
            throw new ClientException(String.format("Failed to acquire lock for key %s in cache '%s' within %d ms", key, name(), timeoutMillis));
         }
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new ClientException("Interrupted while acquiring lock for key " + key, e);
      }
      return new LocalLock(name(), key, semaphore);
   }
}
