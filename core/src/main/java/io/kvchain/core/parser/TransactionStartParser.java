package io.kvchain.core.parser;

import io.kvchain.api.client.TransactionConcurrency;
import io.kvchain.api.client.TransactionIsolation;
import io.kvchain.core.actions.tx.TransactionStartAction;
import io.kvchain.core.chain.ChainBuilder;

class TransactionStartParser extends AbstractParser<ChainBuilder, TransactionStartAction.Builder> {

   TransactionStartParser() {
      register("concurrency", PropertyParser.choice(TransactionConcurrency.class, TransactionStartAction.Builder::concurrency));
      register("isolation", PropertyParser.choice(TransactionIsolation.class, TransactionStartAction.Builder::isolation));
      register("timeout", PropertyParser.duration(TransactionStartAction.Builder::timeout));
      register("size", PropertyParser.integer(TransactionStartAction.Builder::size));
      register("as", PropertyParser.text(TransactionStartAction.Builder::as));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      callSubBuilders(ctx, target.txStart());
   }
}
