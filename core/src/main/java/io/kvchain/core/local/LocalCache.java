package io.kvchain.core.local;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.CacheEntryProcessor;
import io.kvchain.api.client.CacheLock;
import io.kvchain.api.client.ClientException;
import io.kvchain.api.client.TransactionApi;

/**
 * View of a {@link LocalStore}, optionally bound to a transaction. Values are kept as they are,
 * therefore the keep-binary view differs only in the flag it reports.
 * <p>
 * Writes through a transaction-bound view are buffered until commit regardless of the cache's
 * {@link io.kvchain.api.client.CacheAtomicity}.
 */
class LocalCache<K, V> implements CacheApi<K, V> {
   private final LocalClient client;
   private final LocalStore store;
   private final boolean keepBinary;
   private final LocalTransaction transaction;

   LocalCache(LocalClient client, LocalStore store, boolean keepBinary, LocalTransaction transaction) {
      this.client = client;
      this.store = store;
      this.keepBinary = keepBinary;
      this.transaction = transaction;
   }

   @Override
   public String name() {
      return store.name();
   }

   @Override
   public Map<K, V> get(K key) {
      client.ensureOpen();
      return entry(key, read(key));
   }

   @Override
   public CompletableFuture<Map<K, V>> getAsync(K key) {
      return async(() -> get(key));
   }

   @Override
   public Map<K, V> getAll(Set<K> keys) {
      client.ensureOpen();
      Map<K, V> result = new LinkedHashMap<>();
      for (K key : keys) {
         V value = read(key);
         if (value != null) {
            result.put(key, value);
         }
      }
      return result;
   }

   @Override
   public CompletableFuture<Map<K, V>> getAllAsync(Set<K> keys) {
      return async(() -> getAll(keys));
   }

   @Override
   public void put(K key, V value) {
      client.ensureOpen();
      write(key, requireValue(value));
   }

   @Override
   public CompletableFuture<Void> putAsync(K key, V value) {
      return async(() -> {
         put(key, value);
         return null;
      });
   }

   @Override
   public void putAll(Map<K, V> entries) {
      client.ensureOpen();
      entries.values().forEach(this::requireValue);
      entries.forEach(this::write);
   }

   @Override
   public CompletableFuture<Void> putAllAsync(Map<K, V> entries) {
      return async(() -> {
         putAll(entries);
         return null;
      });
   }

   @Override
   public Map<K, V> getAndPut(K key, V value) {
      client.ensureOpen();
      requireValue(value);
      if (transaction == null) {
         return entry(key, cast(store.data().put(requireKey(key), value)));
      }
      V previous = read(key);
      write(key, value);
      return entry(key, previous);
   }

   @Override
   public CompletableFuture<Map<K, V>> getAndPutAsync(K key, V value) {
      return async(() -> getAndPut(key, value));
   }

   @Override
   public Map<K, V> getAndRemove(K key) {
      client.ensureOpen();
      if (transaction == null) {
         return entry(key, cast(store.data().remove(requireKey(key))));
      }
      V previous = read(key);
      write(key, null);
      return entry(key, previous);
   }

   @Override
   public CompletableFuture<Map<K, V>> getAndRemoveAsync(K key) {
      return async(() -> getAndRemove(key));
   }

   @Override
   public void remove(K key) {
      client.ensureOpen();
      write(key, null);
   }

   @Override
   public CompletableFuture<Void> removeAsync(K key) {
      return async(() -> {
         remove(key);
         return null;
      });
   }

   @Override
   public void removeAll(Set<K> keys) {
      client.ensureOpen();
      keys.forEach(key -> write(key, null));
   }

   @Override
   public CompletableFuture<Void> removeAllAsync(Set<K> keys) {
      return async(() -> {
         removeAll(keys);
         return null;
      });
   }

   @Override
   public <T> Map<K, T> invoke(K key, CacheEntryProcessor<K, V, T> processor) {
      client.ensureOpen();
      requireKey(key);
      Object[] result = new Object[1];
      try {
         if (transaction == null) {
            store.data().compute(key, (k, current) -> {
               LocalMutableEntry<K, V> entry = new LocalMutableEntry<>(key, cast(current));
               result[0] = processor.process(entry);
               return entry.isModified() ? entry.getValue() : current;
            });
         } else {
            LocalMutableEntry<K, V> entry = new LocalMutableEntry<>(key, read(key));
            result[0] = processor.process(entry);
            if (entry.isModified()) {
               write(key, entry.getValue());
            }
         }
      } catch (ClientException e) {
         throw e;
      } catch (RuntimeException e) {
         throw new ClientException("Entry processor failed for key " + key + ": " + e, e);
      }
      @SuppressWarnings("unchecked")
      T value = (T) result[0];
      return value == null ? Collections.emptyMap() : Collections.singletonMap(key, value);
   }

   @Override
   public <T> CompletableFuture<Map<K, T>> invokeAsync(K key, CacheEntryProcessor<K, V, T> processor) {
      return async(() -> invoke(key, processor));
   }

   @Override
   public CacheLock lock(K key) {
      client.ensureOpen();
      return store.lock(requireKey(key), client.cluster().lockTimeout());
   }

   @Override
   public CacheApi<K, V> withKeepBinary() {
      return keepBinary ? this : new LocalCache<>(client, store, true, transaction);
   }

   @Override
   public boolean isKeepBinary() {
      return keepBinary;
   }

   @Override
   public CacheApi<K, V> inTransaction(TransactionApi transaction) {
      if (!(transaction instanceof LocalTransaction)) {
         throw new ClientException("Transaction " + transaction + " was not started by a local client");
      }
      return new LocalCache<>(client, store, keepBinary, (LocalTransaction) transaction);
   }

   private V read(K key) {
      requireKey(key);
      return cast(transaction == null ? store.data().get(key) : transaction.read(store, key));
   }

   private void write(K key, V value) {
      requireKey(key);
      if (transaction != null) {
         transaction.write(store, key, value);
      } else if (value == null) {
         store.data().remove(key);
      } else {
         store.data().put(key, value);
      }
   }

   private <T> CompletableFuture<T> async(Supplier<T> supplier) {
      return CompletableFuture.supplyAsync(supplier, client.cluster().asyncExecutor());
   }

   private K requireKey(K key) {
      if (key == null) {
         throw new ClientException("Null keys are not supported");
      }
      return key;
   }

   private V requireValue(V value) {
      if (value == null) {
         throw new ClientException("Null values are not supported");
      }
      return value;
   }

   private Map<K, V> entry(K key, V value) {
      return value == null ? Collections.emptyMap() : Collections.singletonMap(key, value);
   }

   @SuppressWarnings("unchecked")
   private V cast(Object value) {
      return (V) value;
   }

   @Override
   public String toString() {
      return "LocalCache{" + store.name() + (keepBinary ? ", keepBinary" : "") + (transaction != null ? ", transactional}" : "}");
   }
}
