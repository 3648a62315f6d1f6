package io.kvchain.core.actions.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.CacheEntryProcessor;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Session;
import io.kvchain.core.actions.CacheAction;
import io.kvchain.core.actions.ResolutionException;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainContext;
import io.kvchain.core.check.Check;
import io.kvchain.core.check.CheckPipeline;
import io.kvchain.core.generators.ObjectSource;
import io.kvchain.function.SerializableFunction;

/**
 * Key-value operation on a cache. The result of every operation is presented to the checks
 * as a map of entries: writes without a return value yield an empty map.
 */
public class CacheRequestAction extends CacheAction<Map<Object, Object>> {
   private final CacheOperation operation;
   private final SerializableFunction<Session, Object> key;
   private final SerializableFunction<Session, Object> value;
   private final SerializableFunction<Session, Map.Entry<?, ?>> entry;
   private final SerializableFunction<Session, Object> keys;
   private final SerializableFunction<Session, Object> entries;
   private final CacheEntryProcessor<Object, Object, Object> processor;

   public CacheRequestAction(String request, CacheOperation operation, String cacheName, boolean keepBinary, boolean async,
                             CheckPipeline<Map<Object, Object>> checks,
                             SerializableFunction<Session, Object> key, SerializableFunction<Session, Object> value,
                             SerializableFunction<Session, Map.Entry<?, ?>> entry,
                             SerializableFunction<Session, Object> keys, SerializableFunction<Session, Object> entries,
                             CacheEntryProcessor<Object, Object, Object> processor) {
      super(operation.verb(), request, cacheName, keepBinary, async, checks);
      this.operation = operation;
      this.key = key;
      this.value = value;
      this.entry = entry;
      this.keys = keys;
      this.entries = entries;
      this.processor = processor;
   }

   public CacheOperation operation() {
      return operation;
   }

   @Override
   protected CompletableFuture<Map<Object, Object>> invoke(CacheApi<Object, Object> cache, Session session) throws ResolutionException {
      switch (operation) {
         case PUT: {
            Object key;
            Object value;
            if (entry != null) {
               Map.Entry<?, ?> e = resolveEntry(session);
               key = e.getKey();
               value = e.getValue();
            } else {
               key = resolve(this.key, session);
               value = resolve(this.value, session);
            }
            if (async) {
               return cache.putAsync(key, value).thenApply(nil -> Collections.<Object, Object>emptyMap());
            }
            return call(() -> {
               cache.put(key, value);
               return Collections.<Object, Object>emptyMap();
            });
         }
         case PUT_ALL: {
            Map<Object, Object> entries = resolveEntries(session);
            if (async) {
               return cache.putAllAsync(entries).thenApply(nil -> Collections.<Object, Object>emptyMap());
            }
            return call(() -> {
               cache.putAll(entries);
               return Collections.<Object, Object>emptyMap();
            });
         }
         case GET: {
            Object key = resolve(this.key, session);
            return async ? cache.getAsync(key) : call(() -> cache.get(key));
         }
         case GET_ALL: {
            Set<Object> keys = resolveKeys(session);
            return async ? cache.getAllAsync(keys) : call(() -> cache.getAll(keys));
         }
         case GET_AND_PUT: {
            Object key = resolve(this.key, session);
            Object value = resolve(this.value, session);
            return async ? cache.getAndPutAsync(key, value) : call(() -> cache.getAndPut(key, value));
         }
         case GET_AND_REMOVE: {
            Object key = resolve(this.key, session);
            return async ? cache.getAndRemoveAsync(key) : call(() -> cache.getAndRemove(key));
         }
         case REMOVE: {
            Object key = resolve(this.key, session);
            if (async) {
               return cache.removeAsync(key).thenApply(nil -> Collections.<Object, Object>emptyMap());
            }
            return call(() -> {
               cache.remove(key);
               return Collections.<Object, Object>emptyMap();
            });
         }
         case REMOVE_ALL: {
            Set<Object> keys = resolveKeys(session);
            if (async) {
               return cache.removeAllAsync(keys).thenApply(nil -> Collections.<Object, Object>emptyMap());
            }
            return call(() -> {
               cache.removeAll(keys);
               return Collections.<Object, Object>emptyMap();
            });
         }
         case INVOKE: {
            Object key = resolve(this.key, session);
            return async ? cache.invokeAsync(key, processor) : call(() -> cache.invoke(key, processor));
         }
         default:
            throw new IllegalStateException("Operation " + operation + " not implemented");
      }
   }

   private Map.Entry<?, ?> resolveEntry(Session session) throws ResolutionException {
      Map.Entry<?, ?> e;
      try {
         e = entry.apply(session);
      } catch (RuntimeException ex) {
         throw new ResolutionException(String.valueOf(ex.getMessage()));
      }
      if (e == null) {
         throw new ResolutionException("entry function returned null");
      }
      return e;
   }

   private Set<Object> resolveKeys(Session session) throws ResolutionException {
      Object keys = resolve(this.keys, session);
      if (keys instanceof Collection) {
         return new LinkedHashSet<>((Collection<?>) keys);
      } else if (keys instanceof Object[]) {
         Set<Object> set = new LinkedHashSet<>();
         Collections.addAll(set, (Object[]) keys);
         return set;
      }
      throw new ResolutionException("keys must be a collection, got " + keys);
   }

   private Map<Object, Object> resolveEntries(Session session) throws ResolutionException {
      Object entries = resolve(this.entries, session);
      if (entries instanceof Map) {
         return new LinkedHashMap<>((Map<?, ?>) entries);
      }
      throw new ResolutionException("entries must be a map, got " + entries);
   }

   /**
    * Builds {@link CacheRequestAction}.
    */
   public static class Builder implements ActionBuilder {
      private final ChainBuilder parent;
      private final CacheOperation operation;
      private String cacheName;
      private final List<Check<Map<Object, Object>>> checks = new ArrayList<>();
      private String name;
      private SerializableFunction<Session, Object> key;
      private SerializableFunction<Session, Object> value;
      private SerializableFunction<Session, Map.Entry<?, ?>> entry;
      private SerializableFunction<Session, Object> keys;
      private SerializableFunction<Session, Object> entries;
      private CacheEntryProcessor<Object, Object, Object> processor;
      private boolean keepBinary;
      private boolean async;
      private boolean strictChecks;

      public Builder(ChainBuilder parent, CacheOperation operation, String cacheName) {
         this.parent = parent;
         this.operation = operation;
         this.cacheName = cacheName;
      }

      public Builder cache(String cacheName) {
         this.cacheName = cacheName;
         return this;
      }

      /**
       * Request name used in statistics; defaults to <code>operation cacheName</code>.
       *
       * @param name Request name.
       * @return Self.
       */
      public Builder as(String name) {
         this.name = name;
         return this;
      }

      /**
       * @param key Constant key or a <code>${var}</code> pattern.
       * @return Self.
       */
      public Builder key(Object key) {
         this.key = ObjectSource.of(key);
         return this;
      }

      public Builder key(SerializableFunction<Session, ?> key) {
         this.key = session -> key.apply(session);
         return this;
      }

      public Builder value(Object value) {
         this.value = ObjectSource.of(value);
         return this;
      }

      public Builder value(SerializableFunction<Session, ?> value) {
         this.value = session -> value.apply(session);
         return this;
      }

      /**
       * Computes both key and value of a <code>put</code> at once.
       *
       * @param entry Function producing the entry.
       * @return Self.
       */
      public Builder entry(SerializableFunction<Session, ? extends Map.Entry<?, ?>> entry) {
         this.entry = session -> entry.apply(session);
         return this;
      }

      public Builder keys(Object... keys) {
         return keys(List.of(keys));
      }

      public Builder keys(Collection<?> keys) {
         this.keys = ObjectSource.of(keys);
         return this;
      }

      public Builder keys(SerializableFunction<Session, ? extends Collection<?>> keys) {
         this.keys = session -> keys.apply(session);
         return this;
      }

      public Builder keysFrom(String pattern) {
         this.keys = ObjectSource.pattern(pattern);
         return this;
      }

      public Builder entries(Map<?, ?> entries) {
         this.entries = ObjectSource.of(entries);
         return this;
      }

      public Builder entries(SerializableFunction<Session, ? extends Map<?, ?>> entries) {
         this.entries = session -> entries.apply(session);
         return this;
      }

      public Builder entriesFrom(String pattern) {
         this.entries = ObjectSource.pattern(pattern);
         return this;
      }

      @SuppressWarnings("unchecked")
      public Builder processor(CacheEntryProcessor<?, ?, ?> processor) {
         this.processor = (CacheEntryProcessor<Object, Object, Object>) processor;
         return this;
      }

      /**
       * Work with values in their binary form.
       *
       * @return Self.
       */
      public Builder keepBinary() {
         return keepBinary(true);
      }

      public Builder keepBinary(boolean keepBinary) {
         this.keepBinary = keepBinary;
         return this;
      }

      /**
       * Use the async API. Fails at runtime inside a transaction or after explicit locks were taken.
       *
       * @return Self.
       */
      public Builder async() {
         return async(true);
      }

      public Builder async(boolean async) {
         this.async = async;
         return this;
      }

      @SafeVarargs
      @SuppressWarnings({ "unchecked", "rawtypes" })
      public final Builder check(Check<? extends Map<?, ?>>... checks) {
         for (Check<? extends Map<?, ?>> check : checks) {
            this.checks.add((Check<Map<Object, Object>>) (Check) check);
         }
         return this;
      }

      /**
       * Stop evaluating checks on the first failure.
       *
       * @return Self.
       */
      public Builder strictChecks() {
         this.strictChecks = true;
         return this;
      }

      public ChainBuilder end() {
         return parent;
      }

      @Override
      public Action build(ChainContext context) {
         if (cacheName == null || cacheName.isEmpty()) {
            throw new ChainDefinitionException(context.chainName(), operation.verb() + ": cache name is not set");
         }
         switch (operation) {
            case PUT:
               if (entry == null) {
                  require(context, key, "key");
                  require(context, value, "value");
               } else if (key != null || value != null) {
                  throw new ChainDefinitionException(context.chainName(), describe() + ": use either entry or key and value");
               }
               break;
            case GET_AND_PUT:
               require(context, key, "key");
               require(context, value, "value");
               break;
            case GET:
            case GET_AND_REMOVE:
            case REMOVE:
               require(context, key, "key");
               break;
            case GET_ALL:
            case REMOVE_ALL:
               require(context, keys, "keys");
               break;
            case PUT_ALL:
               require(context, entries, "entries");
               break;
            case INVOKE:
               require(context, key, "key");
               require(context, processor, "processor");
               break;
            default:
               throw new IllegalStateException();
         }
         String request = name != null ? name : describe();
         CheckPipeline<Map<Object, Object>> pipeline = checks.isEmpty() ? CheckPipeline.empty() : new CheckPipeline<>(checks, strictChecks);
         return new CacheRequestAction(request, operation, cacheName, keepBinary, async, pipeline, key, value, entry, keys, entries, processor);
      }

      private String describe() {
         return operation.verb() + " " + cacheName;
      }

      private void require(ChainContext context, Object property, String propertyName) {
         if (property == null) {
            throw new ChainDefinitionException(context.chainName(), describe() + ": " + propertyName + " is not set");
         }
      }
   }
}
