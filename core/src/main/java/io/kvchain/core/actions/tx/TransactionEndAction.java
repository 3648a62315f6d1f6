package io.kvchain.core.actions.tx;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.core.actions.BaseAction;
import io.kvchain.core.actions.ResolutionException;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainContext;

/**
 * Commits or rolls back the active transaction. The transaction stays in the session until it is closed.
 */
public class TransactionEndAction extends BaseAction {
   private final Kind kind;

   public TransactionEndAction(String request, Kind kind) {
      super(kind.actionType, request);
      this.kind = kind;
   }

   @Override
   protected String resource() {
      return null;
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      TransactionApi transaction = session.transaction().orElse(null);
      if (transaction == null) {
         return resolutionFailed(session, new ResolutionException("no active transaction"));
      }
      try {
         if (kind == Kind.COMMIT) {
            transaction.commit();
         } else {
            transaction.rollback();
         }
      } catch (RuntimeException e) {
         return CompletableFuture.completedFuture(operationFailed(session, e));
      }
      log.trace("#{} transaction {}", session.userId(), kind == Kind.COMMIT ? "committed" : "rolled back");
      return CompletableFuture.completedFuture(Outcome.proceed(session));
   }

   public enum Kind {
      COMMIT("commit"),
      ROLLBACK("rollback");

      private final String actionType;

      Kind(String actionType) {
         this.actionType = actionType;
      }
   }

   public static class Builder implements ActionBuilder {
      private final Kind kind;
      private String name;

      public Builder(Kind kind) {
         this.kind = kind;
      }

      public Builder as(String name) {
         this.name = name;
         return this;
      }

      @Override
      public Action build(ChainContext context) {
         return new TransactionEndAction(name != null ? name : kind.actionType, kind);
      }
   }
}
