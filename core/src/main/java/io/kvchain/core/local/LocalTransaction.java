package io.kvchain.core.local;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.client.ClientException;
import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.client.TransactionParameters;

/**
 * Transaction buffering writes until commit. Reads see the transaction's own writes on top of
 * the committed data. Closing a transaction that was not committed discards its writes.
 */
public class LocalTransaction implements TransactionApi {
   private static final Logger log = LogManager.getLogger(LocalTransaction.class);
   private static final Object REMOVED = new Object();

   private final LocalCluster cluster;
   private final TransactionParameters parameters;
   private final long startTimestamp = System.currentTimeMillis();
   private final Map<LocalStore, Map<Object, Object>> writes = new LinkedHashMap<>();
   private State state = State.ACTIVE;

   LocalTransaction(LocalCluster cluster, TransactionParameters parameters) {
      this.cluster = cluster;
      this.parameters = parameters;
   }

   @Override
   public TransactionParameters parameters() {
      return parameters;
   }

   public synchronized State state() {
      return state;
   }

   synchronized Object read(LocalStore store, Object key) {
      ensureActive();
      Map<Object, Object> storeWrites = writes.get(store);
      if (storeWrites != null && storeWrites.containsKey(key)) {
         Object value = storeWrites.get(key);
         return value == REMOVED ? null : value;
      }
      return store.data().get(key);
   }

   synchronized void write(LocalStore store, Object key, Object value) {
      ensureActive();
      Map<Object, Object> storeWrites = writes.computeIfAbsent(store, s -> new LinkedHashMap<>());
      if (parameters.size() > 0 && !storeWrites.containsKey(key) && pendingWrites() >= parameters.size()) {
         throw new ClientException("Transaction size " + parameters.size() + " exceeded");
      }
      storeWrites.put(key, value == null ? REMOVED : value);
   }

   private int pendingWrites() {
      int count = 0;
      for (Map<Object, Object> storeWrites : writes.values()) {
         count += storeWrites.size();
      }
      return count;
   }

   @Override
   public synchronized void commit() {
      ensureActive();
      synchronized (cluster) {
         writes.forEach((store, storeWrites) -> store.apply(storeWrites, REMOVED));
      }
      log.trace("Committed writes to {} caches", writes.size());
      writes.clear();
      state = State.COMMITTED;
   }

   @Override
   public synchronized void rollback() {
      ensureActive();
      writes.clear();
      state = State.ROLLED_BACK;
   }

   @Override
   public synchronized void close() {
      if (state == State.CLOSED) {
         return;
      }
      if (state == State.ACTIVE && !writes.isEmpty()) {
         log.trace("Discarding uncommitted writes to {} caches", writes.size());
      }
      writes.clear();
      state = State.CLOSED;
   }

   private void ensureActive() {
      if (state == State.ACTIVE && parameters.timeout() > 0 && System.currentTimeMillis() - startTimestamp > parameters.timeout()) {
         writes.clear();
         state = State.ROLLED_BACK;
         throw new ClientException("Transaction timed out after " + parameters.timeout() + " ms and was rolled back");
      }
      if (state != State.ACTIVE) {
         throw new ClientException("Transaction is " + state.name().toLowerCase(Locale.ROOT).replace('_', ' '));
      }
   }

   public enum State {
      ACTIVE,
      COMMITTED,
      ROLLED_BACK,
      CLOSED
   }
}
