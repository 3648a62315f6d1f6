package io.kvchain.core.chain;

import java.util.function.Consumer;

import io.kvchain.api.client.TransactionConcurrency;
import io.kvchain.api.client.TransactionIsolation;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.core.actions.tx.TransactionStartAction;

/**
 * Begin, body and close of a transaction. Commit must be part of the body; closing a transaction
 * that was not committed discards its writes.
 */
public class TransactionScopeBuilder {
   private final ChainBuilder parent;
   private final TransactionStartAction.Builder begin;
   private final ChainBuilder body;
   private String name;
   private boolean added;

   TransactionScopeBuilder(ChainBuilder parent) {
      this.parent = parent;
      this.begin = new TransactionStartAction.Builder(parent);
      this.body = new ChainBuilder(parent.name());
   }

   public TransactionScopeBuilder concurrency(TransactionConcurrency concurrency) {
      begin.concurrency(concurrency);
      return this;
   }

   public TransactionScopeBuilder isolation(TransactionIsolation isolation) {
      begin.isolation(isolation);
      return this;
   }

   public TransactionScopeBuilder timeout(long timeout) {
      begin.timeout(timeout);
      return this;
   }

   public TransactionScopeBuilder size(int size) {
      begin.size(size);
      return this;
   }

   /**
    * @param name Name prefixing the statistics of all actions in the scope.
    * @return Self.
    */
   public TransactionScopeBuilder as(String name) {
      this.name = name;
      return this;
   }

   /**
    * Defines the body of the scope and adds the scope to the chain.
    *
    * @param body Consumer adding actions to the body.
    * @return Parent chain builder.
    */
   public ChainBuilder run(Consumer<ChainBuilder> body) {
      body.accept(this.body);
      return end();
   }

   /**
    * @return Builder of the actions running in the transaction.
    */
   public ChainBuilder body() {
      return body;
   }

   /**
    * Adds the scope to the chain.
    *
    * @return Parent chain builder.
    */
   public ChainBuilder end() {
      if (added) {
         throw new ChainDefinitionException(parent.name(), "transaction scope was already added");
      }
      added = true;
      parent.addScope(this);
      return parent;
   }

   String name() {
      return name;
   }

   TransactionStartAction.Builder begin() {
      return begin;
   }
}
