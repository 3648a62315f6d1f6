package io.kvchain.core.actions.cache;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.CacheAtomicity;
import io.kvchain.api.client.CacheConfiguration;
import io.kvchain.api.client.CacheMode;
import io.kvchain.api.client.ClientApi;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.core.actions.BaseAction;
import io.kvchain.core.actions.ParameterResolver;
import io.kvchain.core.actions.ResolutionException;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainContext;

/**
 * Gets or creates a cache with given configuration.
 */
public class CreateCacheAction extends BaseAction {
   private final CacheConfiguration configuration;
   private final boolean async;

   public CreateCacheAction(String request, CacheConfiguration configuration, boolean async) {
      super("createCache", request);
      this.configuration = configuration;
      this.async = async;
   }

   @Override
   protected String resource() {
      return configuration.name();
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      ClientApi client;
      try {
         client = ParameterResolver.resolveClient(session, async).client();
      } catch (ResolutionException e) {
         return resolutionFailed(session, e);
      }
      CompletableFuture<CacheApi<Object, Object>> future;
      try {
         if (async) {
            future = client.getOrCreateCacheAsync(configuration);
         } else {
            future = call(() -> client.getOrCreateCache(configuration));
         }
      } catch (RuntimeException e) {
         future = CompletableFuture.failedFuture(e);
      }
      return future.handle((cache, t) -> {
         if (t != null) {
            return operationFailed(session, t);
         }
         log.debug("#{} cache {} is available", session.userId(), configuration.name());
         return Outcome.proceed(session);
      });
   }

   public static class Builder implements ActionBuilder {
      private final ChainBuilder parent;
      private String cacheName;
      private int backups;
      private CacheAtomicity atomicity = CacheAtomicity.ATOMIC;
      private CacheMode mode = CacheMode.PARTITIONED;
      private boolean async;
      private String name;

      public Builder(ChainBuilder parent, String cacheName) {
         this.parent = parent;
         this.cacheName = cacheName;
      }

      public Builder cache(String cacheName) {
         this.cacheName = cacheName;
         return this;
      }

      /**
       * @param backups Number of backup copies of each entry.
       * @return Self.
       */
      public Builder backups(int backups) {
         this.backups = backups;
         return this;
      }

      public Builder atomicity(CacheAtomicity atomicity) {
         this.atomicity = atomicity;
         return this;
      }

      public Builder mode(CacheMode mode) {
         this.mode = mode;
         return this;
      }

      public Builder async() {
         return async(true);
      }

      public Builder async(boolean async) {
         this.async = async;
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
         CacheConfiguration configuration;
         if (cacheName == null || cacheName.isEmpty()) {
            throw new ChainDefinitionException(context.chainName(), "createCache: cache name is not set");
         }
         try {
            configuration = new CacheConfiguration(cacheName, backups, atomicity, mode);
         } catch (RuntimeException e) {
            throw new ChainDefinitionException(context.chainName(), "createCache: " + e.getMessage());
         }
         return new CreateCacheAction(name != null ? name : "createCache " + cacheName, configuration, async);
      }
   }
}
