package io.kvchain.core.actions.tx;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.api.session.SessionKey;
import io.kvchain.core.actions.BaseAction;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainContext;

/**
 * Closes the active transaction, discarding writes that were not committed. Without an active
 * transaction this is a no-op. The transaction is removed from the session even if closing fails.
 */
public class TransactionCloseAction extends BaseAction {

   public TransactionCloseAction(String request) {
      super("txClose", request);
   }

   @Override
   protected String resource() {
      return null;
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      TransactionApi transaction = session.transaction().orElse(null);
      if (transaction == null) {
         return CompletableFuture.completedFuture(Outcome.proceed(session));
      }
      Session withoutTransaction = session.remove(SessionKey.TRANSACTION);
      try {
         transaction.close();
      } catch (RuntimeException e) {
         return CompletableFuture.completedFuture(operationFailed(withoutTransaction, e));
      }
      log.trace("#{} transaction closed", session.userId());
      return CompletableFuture.completedFuture(Outcome.proceed(withoutTransaction));
   }

   public static class Builder implements ActionBuilder {
      private String name;

      public Builder as(String name) {
         this.name = name;
         return this;
      }

      @Override
      public Action build(ChainContext context) {
         return new TransactionCloseAction(name != null ? name : "txClose");
      }
   }
}
