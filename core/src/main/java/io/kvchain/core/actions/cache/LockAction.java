package io.kvchain.core.actions.cache;

import java.util.concurrent.CompletableFuture;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.CacheLock;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Session;
import io.kvchain.api.session.SessionKey;
import io.kvchain.core.actions.CacheAction;
import io.kvchain.core.actions.ResolutionException;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainContext;
import io.kvchain.core.check.CheckPipeline;
import io.kvchain.core.generators.ObjectSource;
import io.kvchain.function.SerializableFunction;

/**
 * Acquires an explicit lock on a key and saves the lock handle in the session.
 * Once any lock was taken the session must not use the async API.
 */
public class LockAction extends CacheAction<CacheLock> {
   private final SerializableFunction<Session, Object> key;
   private final String saveAs;

   public LockAction(String request, String cacheName, SerializableFunction<Session, Object> key, String saveAs) {
      super("lock", request, cacheName, false, false, CheckPipeline.empty());
      this.key = key;
      this.saveAs = saveAs;
   }

   @Override
   protected CompletableFuture<CacheLock> invoke(CacheApi<Object, Object> cache, Session session) throws ResolutionException {
      if (session.attribute(saveAs).isPresent()) {
         throw new ResolutionException("variable " + saveAs + " is already set");
      }
      Object key = resolve(this.key, session);
      return call(() -> cache.lock(key));
   }

   @Override
   protected Session onSuccess(Session session, CacheLock lock) {
      log.trace("#{} locked {} in {}", session.userId(), lock.key(), cacheName);
      return session.set(SessionKey.EXPLICIT_LOCK, Boolean.TRUE).setAttribute(saveAs, lock);
   }

   public static class Builder implements ActionBuilder {
      private final ChainBuilder parent;
      private String cacheName;
      private SerializableFunction<Session, Object> key;
      private String saveAs = "lock";
      private String name;

      public Builder(ChainBuilder parent, String cacheName) {
         this.parent = parent;
         this.cacheName = cacheName;
      }

      public Builder cache(String cacheName) {
         this.cacheName = cacheName;
         return this;
      }

      public Builder key(Object key) {
         this.key = ObjectSource.of(key);
         return this;
      }

      public Builder key(SerializableFunction<Session, ?> key) {
         this.key = session -> key.apply(session);
         return this;
      }

      /**
       * @param var Variable holding the lock handle; <code>lock</code> by default.
       * @return Self.
       */
      public Builder saveAs(String var) {
         this.saveAs = var;
         return this;
      }

      public Builder as(String name) {
         this.name = name;
         return this;
      }

      public ChainBuilder end() {
         return parent;
      }

      @Override
      public Action build(ChainContext context) {
         if (cacheName == null || key == null) {
            throw new ChainDefinitionException(context.chainName(), "lock requires cache name and key");
         }
         if (saveAs == null || saveAs.isEmpty()) {
            throw new ChainDefinitionException(context.chainName(), "lock " + cacheName + ": variable for the lock is not set");
         }
         return new LockAction(name != null ? name : "lock " + cacheName, cacheName, key, saveAs);
      }
   }
}
