package io.kvchain.core.parser;

import io.kvchain.core.actions.client.ClientCloseAction;
import io.kvchain.core.actions.client.ClientStartAction;
import io.kvchain.core.actions.tx.TransactionCloseAction;
import io.kvchain.core.actions.tx.TransactionEndAction;
import io.kvchain.core.chain.ChainBuilder;

/**
 * Parses actions whose only property is the request name.
 */
class NamedActionParser extends AbstractParser<ChainBuilder, String[]> {
   private final Kind kind;

   NamedActionParser(Kind kind) {
      this.kind = kind;
      register("as", PropertyParser.text((name, value) -> name[0] = value));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      String[] name = new String[1];
      callSubBuilders(ctx, name);
      switch (kind) {
         case COMMIT:
            target.action(new TransactionEndAction.Builder(TransactionEndAction.Kind.COMMIT).as(name[0]));
            break;
         case ROLLBACK:
            target.action(new TransactionEndAction.Builder(TransactionEndAction.Kind.ROLLBACK).as(name[0]));
            break;
         case TX_CLOSE:
            target.action(new TransactionCloseAction.Builder().as(name[0]));
            break;
         case START_CLIENT:
            target.action(new ClientStartAction.Builder().as(name[0]));
            break;
         case CLOSE_CLIENT:
            target.action(new ClientCloseAction.Builder().as(name[0]));
            break;
         default:
            throw new IllegalStateException();
      }
   }

   enum Kind {
      COMMIT,
      ROLLBACK,
      TX_CLOSE,
      START_CLIENT,
      CLOSE_CLIENT
   }
}
