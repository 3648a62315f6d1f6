package io.kvchain.core.parser;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;

import io.kvchain.core.actions.cache.CacheRequestAction;
import io.kvchain.core.check.CheckBuilder;
import io.kvchain.core.check.Checks;
import io.kvchain.core.check.CountCheckBuilder;
import io.kvchain.core.check.EntriesCheckBuilder;

/**
 * Parses checks of a cache request:
 * <ul>
 *    <li><code>exists</code>, <code>notExists</code>: some/no entry was returned</li>
 *    <li><code>count: 1</code> or <code>count: "&gt;= 1"</code>: number of returned entries</li>
 *    <li><code>value: 100</code>: value of the only returned entry</li>
 *    <li><code>saveAs: var</code>: store value of the only returned entry</li>
 *    <li><code>entry: { key: 1, value: 100, saveAs: var, exists: true }</code>: entry for given key</li>
 * </ul>
 */
class ChecksParser implements Parser<CacheRequestAction.Builder> {
   private static final ChecksParser INSTANCE = new ChecksParser();
   private static final Pattern CONDITION = Pattern.compile("\\s*(==|!=|>=|<=|>|<)?\\s*(-?[0-9]+)\\s*");

   static ChecksParser instance() {
      return INSTANCE;
   }

   private ChecksParser() {}

   @Override
   public void parse(Context ctx, CacheRequestAction.Builder target) throws ParserException {
      Event event = ctx.next();
      if (event instanceof ScalarEvent) {
         String name = ((ScalarEvent) event).getValue();
         switch (name) {
            case "exists":
               target.check(Checks.entries().exists());
               break;
            case "notExists":
               target.check(Checks.entries().notExists());
               break;
            default:
               throw new ParserException(event, "Unknown check '" + name + "', expected one of [exists, notExists, count, value, saveAs, entry]");
         }
         return;
      } else if (!(event instanceof MappingStartEvent)) {
         throw ctx.unexpectedEvent(event);
      }
      ScalarEvent checkEvent = ctx.expectEvent(ScalarEvent.class);
      switch (checkEvent.getValue()) {
         case "count":
            target.check(count(ctx.expectEvent(ScalarEvent.class)));
            break;
         case "value":
            target.check(Checks.entries().value().is(ValueParser.parse(ctx)));
            break;
         case "saveAs":
            target.check(Checks.entries().value().saveAs(ctx.expectEvent(ScalarEvent.class).getValue()));
            break;
         case "entry":
            EntryCheck entryCheck = new EntryCheck();
            EntryCheckParser.INSTANCE.parse(ctx, entryCheck);
            target.check(entryCheck.build(checkEvent));
            break;
         default:
            throw new ParserException(checkEvent, "Unknown check '" + checkEvent.getValue() + "', expected one of [exists, notExists, count, value, saveAs, entry]");
      }
      ctx.expectEvent(MappingEndEvent.class);
   }

   private CheckBuilder<Map<Object, Object>, Integer> count(ScalarEvent event) throws ParserException {
      Matcher matcher = CONDITION.matcher(event.getValue());
      if (!matcher.matches()) {
         throw new ParserException(event, "Cannot parse count condition '" + event.getValue() + "', expected e.g. '1' or '> 0'");
      }
      int value = Integer.parseInt(matcher.group(2));
      CountCheckBuilder<Map<Object, Object>> count = Checks.entries().count();
      String operator = matcher.group(1);
      if (operator == null) {
         return count.is(value);
      }
      switch (operator) {
         case "==":
            return count.is(value);
         case "!=":
            return count.not(value);
         case ">":
            return count.gt(value);
         case ">=":
            return count.gte(value);
         case "<":
            return count.lt(value);
         case "<=":
            return count.lte(value);
         default:
            throw new ParserException(event, "Unknown operator " + operator);
      }
   }

   private static class EntryCheck {
      private Object key;
      private boolean hasKey;
      private Object value;
      private boolean hasValue;
      private String saveAs;
      private Boolean exists;

      CheckBuilder<Map<Object, Object>, Object> build(Event event) throws ParserException {
         if (!hasKey) {
            throw new ParserException(event, "Entry check requires a key");
         }
         EntriesCheckBuilder<Object, Object> entries = Checks.entries();
         CheckBuilder<Map<Object, Object>, Object> check = entries.key(key);
         if (hasValue) {
            check = check.is(value);
         } else if (exists != null) {
            check = exists ? check.exists() : check.notExists();
         }
         if (saveAs != null) {
            check = check.saveAs(saveAs);
         }
         return check;
      }
   }

   private static class EntryCheckParser extends AbstractParser<EntryCheck, EntryCheck> {
      static final EntryCheckParser INSTANCE = new EntryCheckParser();

      EntryCheckParser() {
         register("key", PropertyParser.value((check, key) -> {
            check.key = key;
            check.hasKey = true;
         }));
         register("value", PropertyParser.value((check, value) -> {
            check.value = value;
            check.hasValue = true;
         }));
         register("saveAs", PropertyParser.text((check, saveAs) -> check.saveAs = saveAs));
         register("exists", PropertyParser.flag((check, exists) -> check.exists = exists));
      }

      @Override
      public void parse(Context ctx, EntryCheck target) throws ParserException {
         callSubBuilders(ctx, target);
      }
   }
}
