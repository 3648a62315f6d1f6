package io.kvchain.core.parser;

import io.kvchain.core.actions.cache.UnlockAction;
import io.kvchain.core.chain.ChainBuilder;

class UnlockParser extends AbstractParser<ChainBuilder, UnlockAction.Builder> {

   UnlockParser() {
      register("lock", PropertyParser.text(UnlockAction.Builder::lock));
      register("as", PropertyParser.text(UnlockAction.Builder::as));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      UnlockAction.Builder builder = new UnlockAction.Builder(target);
      target.action(builder);
      callSubBuilders(ctx, builder);
   }
}
