package io.kvchain.core.parser;

import io.kvchain.api.client.CacheAtomicity;
import io.kvchain.api.client.CacheMode;
import io.kvchain.core.actions.cache.CreateCacheAction;
import io.kvchain.core.chain.ChainBuilder;

class CreateCacheParser extends AbstractParser<ChainBuilder, CreateCacheAction.Builder> {

   CreateCacheParser() {
      register("cache", PropertyParser.text(CreateCacheAction.Builder::cache));
      register("backups", PropertyParser.integer(CreateCacheAction.Builder::backups));
      register("atomicity", PropertyParser.choice(CacheAtomicity.class, CreateCacheAction.Builder::atomicity));
      register("mode", PropertyParser.choice(CacheMode.class, CreateCacheAction.Builder::mode));
      register("async", PropertyParser.flag(CreateCacheAction.Builder::async));
      register("as", PropertyParser.text(CreateCacheAction.Builder::as));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      callSubBuilders(ctx, target.createCache(null));
   }
}
