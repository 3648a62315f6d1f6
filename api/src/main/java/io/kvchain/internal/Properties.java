package io.kvchain.internal;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tuning knobs read from system properties, falling back to environment variables
 * (<code>io.kvchain.threads</code> is also read as <code>IO_KVCHAIN_THREADS</code>).
 */
public interface Properties {
   /** Log stack traces of failed operations. */
   String STACKTRACE = "io.kvchain.stacktrace";
   /** Number of event executors used by the chain runner. */
   String THREADS = "io.kvchain.threads";
   /** Threads completing async operations of the in-memory cluster. */
   String LOCAL_ASYNC_THREADS = "io.kvchain.local.async.threads";
   /** Milliseconds an explicit lock waits in the in-memory cluster. */
   String LOCAL_LOCK_TIMEOUT = "io.kvchain.local.lock.timeout";
   /** Log every YAML event consumed by the chain parser. */
   String PARSER_DEBUG = "io.kvchain.parser.debug";

   static Optional<String> lookup(String property) {
      String value = System.getProperty(property);
      if (value == null) {
         value = System.getenv(property.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT));
      }
      return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
   }

   static String get(String property, String def) {
      return lookup(property).orElse(def);
   }

   static int getInt(String property, int def) {
      return parse(property, Integer::valueOf, def);
   }

   static long getLong(String property, long def) {
      return parse(property, Long::valueOf, def);
   }

   static boolean getBoolean(String property) {
      return parse(property, Boolean::valueOf, false);
   }

   private static <T> T parse(String property, Function<String, T> parser, T def) {
      return lookup(property).map(value -> {
         try {
            return parser.apply(value);
         } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + property + " has invalid value '" + value + "'", e);
         }
      }).orElse(def);
   }
}
