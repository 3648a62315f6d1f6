package io.kvchain.core.parser;

import io.kvchain.core.actions.cache.LockAction;
import io.kvchain.core.chain.ChainBuilder;

class LockParser extends AbstractParser<ChainBuilder, LockAction.Builder> {

   LockParser() {
      register("cache", PropertyParser.text(LockAction.Builder::cache));
      register("key", PropertyParser.value((builder, key) -> builder.key(key)));
      register("saveAs", PropertyParser.text(LockAction.Builder::saveAs));
      register("as", PropertyParser.text(LockAction.Builder::as));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      callSubBuilders(ctx, target.lock(null));
   }
}
