package io.kvchain.core.actions.tx;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.client.TransactionConcurrency;
import io.kvchain.api.client.TransactionIsolation;
import io.kvchain.api.client.TransactionParameters;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.api.session.SessionKey;
import io.kvchain.core.actions.BaseAction;
import io.kvchain.core.actions.ParameterResolver;
import io.kvchain.core.actions.ResolutionException;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainContext;

/**
 * Starts a transaction and stores it in the session; following cache actions take part in it.
 */
public class TransactionStartAction extends BaseAction {
   private final TransactionParameters parameters;

   public TransactionStartAction(String request, TransactionParameters parameters) {
      super("txStart", request);
      this.parameters = parameters;
   }

   @Override
   protected String resource() {
      return null;
   }

   public TransactionParameters parameters() {
      return parameters;
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      ClientApi client;
      try {
         client = ParameterResolver.resolveClient(session, false).client();
         if (session.transaction().isPresent()) {
            throw new ResolutionException("transaction is already started");
         }
      } catch (ResolutionException e) {
         return resolutionFailed(session, e);
      }
      TransactionApi transaction;
      try {
         transaction = client.txStart(parameters);
      } catch (RuntimeException e) {
         return CompletableFuture.completedFuture(operationFailed(session, e));
      }
      log.trace("#{} started transaction {}", session.userId(), parameters);
      return CompletableFuture.completedFuture(Outcome.proceed(session.set(SessionKey.TRANSACTION, transaction)));
   }

   public static class Builder implements ActionBuilder {
      private final ChainBuilder parent;
      private TransactionConcurrency concurrency = TransactionParameters.DEFAULT.concurrency();
      private TransactionIsolation isolation = TransactionParameters.DEFAULT.isolation();
      private long timeout;
      private int size;
      private String name;

      public Builder(ChainBuilder parent) {
         this.parent = parent;
      }

      public Builder concurrency(TransactionConcurrency concurrency) {
         this.concurrency = concurrency;
         return this;
      }

      public Builder isolation(TransactionIsolation isolation) {
         this.isolation = isolation;
         return this;
      }

      /**
       * @param timeout Transaction timeout in milliseconds.
       * @return Self.
       */
      public Builder timeout(long timeout) {
         this.timeout = timeout;
         return this;
      }

      /**
       * @param size Number of entries participating in the transaction.
       * @return Self.
       */
      public Builder size(int size) {
         this.size = size;
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
         if (timeout < 0 || size < 0) {
            throw new ChainDefinitionException(context.chainName(), "txStart: timeout and size must not be negative");
         }
         if (concurrency == null || isolation == null) {
            throw new ChainDefinitionException(context.chainName(), "txStart: concurrency and isolation must be set");
         }
         return new TransactionStartAction(name != null ? name : "txStart", new TransactionParameters(concurrency, isolation, timeout, size));
      }
   }
}
