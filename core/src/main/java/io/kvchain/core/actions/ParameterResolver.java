package io.kvchain.core.actions;

import java.util.Optional;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.session.Session;

/**
 * Picks the client, transaction and cache an action should work with.
 */
public final class ParameterResolver {
   static final String NO_CLIENT = "no active client";
   static final String ASYNC_CONFLICT = "Async API can not be used in transaction context or along with explicit locks";
   static final String ASYNC_UNSUPPORTED = "client does not support async operations";

   private ParameterResolver() {}

   public static ClientParameters resolveClient(Session session, boolean async) throws ResolutionException {
      ClientApi client = session.client().orElseThrow(() -> new ResolutionException(NO_CLIENT));
      Optional<TransactionApi> transaction = session.transaction();
      if (async) {
         if (session.explicitLocksUsed().orElse(false) || transaction.isPresent()) {
            throw new ResolutionException(ASYNC_CONFLICT);
         } else if (!client.asyncSupported()) {
            throw new ResolutionException(ASYNC_UNSUPPORTED);
         }
      }
      return new ClientParameters(client, transaction);
   }

   /**
    * @param session Current session.
    * @param cacheName Name of the cache.
    * @param keepBinary Use the keep-binary view of the cache.
    * @param async The action is going to use the async API.
    * @return Cache bound to the active transaction, if there is any.
    * @throws ResolutionException if the client is missing, the async API must not be used or the cache lookup fails.
    */
   public static <K, V> CacheParameters<K, V> resolveCache(Session session, String cacheName, boolean keepBinary, boolean async) throws ResolutionException {
      ClientParameters clientParameters = resolveClient(session, async);
      CacheApi<K, V> cache;
      try {
         cache = clientParameters.client().cache(cacheName);
         if (keepBinary) {
            cache = cache.withKeepBinary();
         }
      } catch (RuntimeException e) {
         throw new ResolutionException(e.getMessage() != null ? e.getMessage() : e.toString());
      }
      return new CacheParameters<>(clientParameters.client(), clientParameters.transaction(), cache);
   }

   public static class ClientParameters {
      private final ClientApi client;
      private final Optional<TransactionApi> transaction;

      ClientParameters(ClientApi client, Optional<TransactionApi> transaction) {
         this.client = client;
         this.transaction = transaction;
      }

      public ClientApi client() {
         return client;
      }

      public Optional<TransactionApi> transaction() {
         return transaction;
      }
   }

   public static class CacheParameters<K, V> extends ClientParameters {
      private final CacheApi<K, V> cache;

      CacheParameters(ClientApi client, Optional<TransactionApi> transaction, CacheApi<K, V> cache) {
         super(client, transaction);
         this.cache = cache;
      }

      /**
       * @return Cache taking part in the active transaction, or plain cache if there is none.
       */
      public CacheApi<K, V> cache() {
         return transaction().map(cache::inTransaction).orElse(cache);
      }
   }
}
