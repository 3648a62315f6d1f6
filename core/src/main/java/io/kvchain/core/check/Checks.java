package io.kvchain.core.check;

import java.util.Map;
import java.util.Optional;

/**
 * Entry points for checks on cache operation results.
 */
public final class Checks {
   private Checks() {}

   public static <K, V> EntriesCheckBuilder<K, V> entries() {
      return new EntriesCheckBuilder<>();
   }

   /**
    * @return Check on the whole result map.
    */
   public static <K, V> CheckBuilder<Map<K, V>, Map<K, V>> mapResult() {
      return new CheckBuilder<>("mapResult", (response, session) -> Optional.ofNullable(response));
   }
}
