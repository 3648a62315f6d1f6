package io.kvchain.core.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses a mapping whose keys are known property names, each handled by its own parser.
 *
 * @param <T> Object the surrounding definition passes in.
 * @param <S> Object the properties are applied to.
 */
abstract class AbstractParser<T, S> implements Parser<T> {
   private final Map<String, Parser<S>> properties = new LinkedHashMap<>();

   protected void register(String property, Parser<S> parser) {
      if (properties.putIfAbsent(property, parser) != null) {
         throw new IllegalStateException("Property '" + property + "' registered twice in " + getClass().getSimpleName());
      }
   }

   void callSubBuilders(Context ctx, S target) throws ParserException {
      ctx.parseMapping(target, key -> {
         Parser<S> parser = properties.get(key.getValue());
         if (parser == null) {
            throw new ParserException(key, "Invalid configuration label: '" + key.getValue() + "', expected one of " + properties.keySet());
         }
         return parser;
      });
   }
}
