package io.kvchain.core.actions.cache;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.kvchain.api.client.CacheLock;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.core.actions.BaseAction;
import io.kvchain.core.actions.ResolutionException;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainContext;

/**
 * Releases a lock previously saved by {@link LockAction} and removes it from the session.
 */
public class UnlockAction extends BaseAction {
   private final String var;

   public UnlockAction(String request, String var) {
      super("unlock", request);
      this.var = var;
   }

   @Override
   protected String resource() {
      return var;
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      Object value = session.attribute(var).orElse(null);
      if (!(value instanceof CacheLock)) {
         return resolutionFailed(session, new ResolutionException("no lock saved in variable " + var));
      }
      CacheLock lock = (CacheLock) value;
      try {
         lock.unlock();
      } catch (RuntimeException e) {
         return CompletableFuture.completedFuture(operationFailed(session, e));
      }
      log.trace("#{} unlocked {} in {}", session.userId(), lock.key(), lock.cacheName());
      return CompletableFuture.completedFuture(Outcome.proceed(session.removeAttribute(var)));
   }

   public static class Builder implements ActionBuilder {
      private final ChainBuilder parent;
      private String var = "lock";
      private String name;

      public Builder(ChainBuilder parent) {
         this.parent = parent;
      }

      public Builder lock(String var) {
         this.var = var;
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
         if (var == null || var.isEmpty()) {
            throw new ChainDefinitionException(context.chainName(), "unlock: variable holding the lock is not set");
         }
         return new UnlockAction(name != null ? name : "unlock " + var, var);
      }
   }
}
