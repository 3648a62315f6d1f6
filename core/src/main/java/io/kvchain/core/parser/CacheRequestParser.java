package io.kvchain.core.parser;

import java.util.Collection;
import java.util.Map;

import io.kvchain.core.actions.cache.CacheOperation;
import io.kvchain.core.actions.cache.CacheRequestAction;
import io.kvchain.core.chain.ChainBuilder;

class CacheRequestParser extends AbstractParser<ChainBuilder, CacheRequestAction.Builder> {
   private final CacheOperation operation;

   CacheRequestParser(CacheOperation operation) {
      this.operation = operation;
      register("cache", PropertyParser.text(CacheRequestAction.Builder::cache));
      register("key", PropertyParser.value((builder, key) -> builder.key(key)));
      register("value", PropertyParser.value((builder, value) -> builder.value(value)));
      register("keys", PropertyParser.value(CacheRequestParser::keys));
      register("entries", PropertyParser.value(CacheRequestParser::entries));
      register("async", PropertyParser.flag(CacheRequestAction.Builder::async));
      register("keepBinary", PropertyParser.flag(CacheRequestAction.Builder::keepBinary));
      register("as", PropertyParser.text(CacheRequestAction.Builder::as));
      register("strictChecks", PropertyParser.flag((builder, strict) -> {
         if (strict) {
            builder.strictChecks();
         }
      }));
      register("checks", (ctx, builder) -> ctx.parseList(builder, ChecksParser.instance()));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      callSubBuilders(ctx, target.request(operation, null));
   }

   private static void keys(CacheRequestAction.Builder builder, Object keys) {
      if (keys instanceof Collection) {
         builder.keys((Collection<?>) keys);
      } else if (keys instanceof String) {
         builder.keysFrom((String) keys);
      } else {
         throw new IllegalArgumentException("Keys must be a list or a ${variable}, got " + keys);
      }
   }

   private static void entries(CacheRequestAction.Builder builder, Object entries) {
      if (entries instanceof Map) {
         builder.entries((Map<?, ?>) entries);
      } else if (entries instanceof String) {
         builder.entriesFrom((String) entries);
      } else {
         throw new IllegalArgumentException("Entries must be a mapping or a ${variable}, got " + entries);
      }
   }
}
