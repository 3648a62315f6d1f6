package io.kvchain.core.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;

/**
 * Reads keys and values of cache operations. Plain integer scalars become {@link Integer}
 * (or {@link Long} when they don't fit), plain <code>true</code>/<code>false</code> become
 * {@link Boolean}; quoted scalars are always strings.
 */
final class ValueParser {
   private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

   private ValueParser() {}

   static Object parse(Context ctx) throws ParserException {
      Event event = ctx.next();
      if (event instanceof ScalarEvent) {
         return scalar((ScalarEvent) event);
      } else if (event instanceof SequenceStartEvent) {
         List<Object> list = new ArrayList<>();
         while (ctx.hasNext()) {
            Event item = ctx.peek();
            if (item instanceof SequenceEndEvent) {
               ctx.skipPeeked();
               return list;
            }
            list.add(parse(ctx));
         }
         throw ctx.noMoreEvents(SequenceEndEvent.class);
      } else if (event instanceof MappingStartEvent) {
         Map<Object, Object> map = new LinkedHashMap<>();
         while (ctx.hasNext()) {
            Event item = ctx.peek();
            if (item instanceof MappingEndEvent) {
               ctx.skipPeeked();
               return map;
            }
            Object key = parse(ctx);
            map.put(key, parse(ctx));
         }
         throw ctx.noMoreEvents(MappingEndEvent.class);
      }
      throw ctx.unexpectedEvent(event);
   }

   static Object scalar(ScalarEvent event) {
      String value = event.getValue();
      if (event.getScalarStyle() != DumperOptions.ScalarStyle.PLAIN) {
         return value;
      }
      if (INTEGER.matcher(value).matches()) {
         try {
            return Integer.parseInt(value);
         } catch (NumberFormatException e) {
            try {
               return Long.parseLong(value);
            } catch (NumberFormatException e2) {
               return value;
            }
         }
      } else if ("true".equals(value) || "false".equals(value)) {
         return Boolean.parseBoolean(value);
      }
      return value;
   }
}
