package io.kvchain.core.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;

import io.kvchain.core.actions.cache.CacheOperation;
import io.kvchain.core.chain.ChainBuilder;

/**
 * Parses single item of a chain: either a plain name (<code>- commit</code>) or a mapping
 * with the action name as the only key (<code>- get: { cache: c, key: 1 }</code>).
 */
class ActionParser implements Parser<ChainBuilder> {
   private static final ActionParser INSTANCE = new ActionParser();

   private final Map<String, Parser<ChainBuilder>> parsers = new HashMap<>();
   private final Map<String, Consumer<ChainBuilder>> shortcuts = new HashMap<>();

   public static ActionParser instance() {
      return INSTANCE;
   }

   private ActionParser() {
      for (CacheOperation operation : CacheOperation.values()) {
         parsers.put(operation.verb(), new CacheRequestParser(operation));
      }
      parsers.put("lock", new LockParser());
      parsers.put("unlock", new UnlockParser());
      parsers.put("createCache", new CreateCacheParser());
      parsers.put("txStart", new TransactionStartParser());
      parsers.put("commit", new NamedActionParser(NamedActionParser.Kind.COMMIT));
      parsers.put("rollback", new NamedActionParser(NamedActionParser.Kind.ROLLBACK));
      parsers.put("txClose", new NamedActionParser(NamedActionParser.Kind.TX_CLOSE));
      parsers.put("startClient", new NamedActionParser(NamedActionParser.Kind.START_CLIENT));
      parsers.put("closeClient", new NamedActionParser(NamedActionParser.Kind.CLOSE_CLIENT));
      parsers.put("transaction", new TransactionParser());
      parsers.put("group", new GroupParser());

      shortcuts.put("commit", ChainBuilder::commit);
      shortcuts.put("rollback", ChainBuilder::rollback);
      shortcuts.put("txClose", ChainBuilder::txClose);
      shortcuts.put("txStart", ChainBuilder::txStart);
      shortcuts.put("unlock", ChainBuilder::unlock);
      shortcuts.put("startClient", ChainBuilder::startClient);
      shortcuts.put("closeClient", ChainBuilder::closeClient);
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      Event firstEvent = ctx.next();
      if (firstEvent instanceof ScalarEvent) {
         String name = ((ScalarEvent) firstEvent).getValue();
         Consumer<ChainBuilder> shortcut = shortcuts.get(name);
         if (shortcut == null) {
            throw new ParserException(firstEvent, parsers.containsKey(name) ?
                  "Action '" + name + "' requires parameters" : "Unknown action '" + name + "', expected one of " + parsers.keySet());
         }
         shortcut.accept(target);
         return;
      } else if (!(firstEvent instanceof MappingStartEvent)) {
         throw ctx.unexpectedEvent(firstEvent);
      }
      ScalarEvent actionEvent = ctx.expectEvent(ScalarEvent.class);
      Parser<ChainBuilder> parser = parsers.get(actionEvent.getValue());
      if (parser == null) {
         throw new ParserException(actionEvent, "Unknown action '" + actionEvent.getValue() + "', expected one of " + parsers.keySet());
      }
      parser.parse(ctx, target);
      Event end = ctx.next();
      if (!(end instanceof MappingEndEvent)) {
         throw new ParserException(end, "Action must be defined as a single-key mapping; did you mis-indent the properties of '" + actionEvent.getValue() + "'?");
      }
   }
}
