package io.kvchain.core.actions;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.core.check.CheckException;
import io.kvchain.core.check.CheckPipeline;
import io.kvchain.function.SerializableFunction;

/**
 * Action working with a single cache: resolves the cache from the session, invokes the operation
 * and runs the checks on its result.
 *
 * @param <R> Type of the operation result.
 */
public abstract class CacheAction<R> extends BaseAction {
   protected final String cacheName;
   protected final boolean keepBinary;
   protected final boolean async;
   protected final CheckPipeline<R> checks;

   protected CacheAction(String actionType, String request, String cacheName, boolean keepBinary, boolean async, CheckPipeline<R> checks) {
      super(actionType, request);
      this.cacheName = cacheName;
      this.keepBinary = keepBinary;
      this.async = async;
      this.checks = checks;
   }

   @Override
   protected String resource() {
      return cacheName;
   }

   public boolean isAsync() {
      return async;
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      CacheApi<Object, Object> cache;
      CompletableFuture<R> future;
      try {
         cache = ParameterResolver.<Object, Object>resolveCache(session, cacheName, keepBinary, async).cache();
         future = invoke(cache, session);
      } catch (ResolutionException e) {
         return resolutionFailed(session, e);
      } catch (RuntimeException e) {
         future = CompletableFuture.failedFuture(e);
      }
      if (log.isTraceEnabled()) {
         log.trace("#{} {} invoked {}", session.userId(), request, async ? "async" : "sync");
      }
      return future.handle((result, t) -> t != null ? operationFailed(session, t) : onResult(session, result));
   }

   private Outcome onResult(Session session, R result) {
      Session updated = onSuccess(session, result);
      try {
         Session next = checks.apply(result, updated);
         if (log.isTraceEnabled()) {
            log.trace("#{} {} completed: {}", session.userId(), request, result);
         }
         return Outcome.proceed(next);
      } catch (CheckException e) {
         return checkFailed(updated, e.getMessage());
      }
   }

   /**
    * Starts the operation. Blocking operations should be run through {@link #call(java.util.concurrent.Callable)}.
    *
    * @param cache Cache bound to the active transaction.
    * @param session Current session.
    * @return Future completed with the result.
    * @throws ResolutionException if the arguments of the operation cannot be computed.
    */
   protected abstract CompletableFuture<R> invoke(CacheApi<Object, Object> cache, Session session) throws ResolutionException;

   /**
    * Hook updating the session with resources acquired by the operation, applied before the checks.
    */
   protected Session onSuccess(Session session, R result) {
      return session;
   }

   protected static Object resolve(SerializableFunction<Session, Object> source, Session session) throws ResolutionException {
      try {
         return source.apply(session);
      } catch (RuntimeException e) {
         throw new ResolutionException(e.getMessage() != null ? e.getMessage() : e.toString());
      }
   }
}
