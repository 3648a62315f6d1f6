package io.kvchain.core.parser;

import java.util.Arrays;
import java.util.function.BiConsumer;

import org.yaml.snakeyaml.events.ScalarEvent;

/**
 * Parsers of single-valued properties in chain definitions.
 */
public final class PropertyParser {
   private PropertyParser() {}

   public static <T> Parser<T> text(BiConsumer<T, String> consumer) {
      return scalar(consumer, "text", ScalarEvent::getValue);
   }

   public static <T> Parser<T> integer(BiConsumer<T, Integer> consumer) {
      return scalar(consumer, "integer", event -> Integer.parseInt(event.getValue()));
   }

   public static <T> Parser<T> duration(BiConsumer<T, Long> consumer) {
      return scalar(consumer, "number of milliseconds", event -> Long.parseLong(event.getValue()));
   }

   public static <T> Parser<T> flag(BiConsumer<T, Boolean> consumer) {
      return scalar(consumer, "true/false", event -> {
         if ("true".equalsIgnoreCase(event.getValue())) {
            return Boolean.TRUE;
         } else if ("false".equalsIgnoreCase(event.getValue())) {
            return Boolean.FALSE;
         }
         throw new IllegalArgumentException();
      });
   }

   public static <T, E extends Enum<E>> Parser<T> choice(Class<E> type, BiConsumer<T, E> consumer) {
      E[] options = type.getEnumConstants();
      return scalar(consumer, "one of " + Arrays.toString(options), event -> {
         for (E option : options) {
            if (option.name().equalsIgnoreCase(event.getValue())) {
               return option;
            }
         }
         throw new IllegalArgumentException();
      });
   }

   /**
    * Constant of any shape: scalars, sequences and mappings.
    */
   public static <T> Parser<T> value(BiConsumer<T, Object> consumer) {
      return (ctx, target) -> consumer.accept(target, ValueParser.parse(ctx));
   }

   private static <T, V> Parser<T> scalar(BiConsumer<T, V> consumer, String expected, Converter<V> converter) {
      return (ctx, target) -> {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         V value;
         try {
            value = converter.convert(event);
         } catch (IllegalArgumentException e) {
            throw new ParserException(event, "Expected " + expected + ", got '" + event.getValue() + "'", e);
         }
         consumer.accept(target, value);
      };
   }

   @FunctionalInterface
   private interface Converter<V> {
      V convert(ScalarEvent event);
   }
}
