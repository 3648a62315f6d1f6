package io.kvchain.core.parser;

import io.kvchain.api.client.TransactionConcurrency;
import io.kvchain.api.client.TransactionIsolation;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.TransactionScopeBuilder;

/**
 * Parses transaction scope: transaction parameters and the <code>chain</code> running in the transaction.
 */
class TransactionParser extends AbstractParser<ChainBuilder, TransactionScopeBuilder> {

   TransactionParser() {
      register("concurrency", PropertyParser.choice(TransactionConcurrency.class, TransactionScopeBuilder::concurrency));
      register("isolation", PropertyParser.choice(TransactionIsolation.class, TransactionScopeBuilder::isolation));
      register("timeout", PropertyParser.duration(TransactionScopeBuilder::timeout));
      register("size", PropertyParser.integer(TransactionScopeBuilder::size));
      register("as", PropertyParser.text(TransactionScopeBuilder::as));
      register("chain", (ctx, scope) -> ctx.parseList(scope.body(), ActionParser.instance()));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      TransactionScopeBuilder scope = target.transaction();
      callSubBuilders(ctx, scope);
      scope.end();
   }
}
