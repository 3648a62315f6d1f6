package io.kvchain.core.check;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks on the entries returned by a cache operation. Without further projection the check
 * works with the only returned entry; more than one entry makes such check fail.
 */
public class EntriesCheckBuilder<K, V> extends CheckBuilder<Map<K, V>, Map.Entry<K, V>> {

   EntriesCheckBuilder() {
      super("entries", onlyEntry("entries"));
   }

   private static <K, V> Extractor<Map<K, V>, Map.Entry<K, V>> onlyEntry(String description) {
      return (response, session) -> {
         if (response == null || response.isEmpty()) {
            return Optional.empty();
         } else if (response.size() > 1) {
            throw new CheckException(description + ": expected at most one entry but found " + response.size() + ": " + response);
         }
         return Optional.of(response.entrySet().iterator().next());
      };
   }

   /**
    * At least one entry was returned.
    */
   @Override
   public CheckBuilder<Map<K, V>, Map.Entry<K, V>> exists() {
      return find(0).exists();
   }

   /**
    * No entry was returned.
    */
   @Override
   public CheckBuilder<Map<K, V>, Map.Entry<K, V>> notExists() {
      return find(0).notExists();
   }

   public CountCheckBuilder<Map<K, V>> count() {
      return new CountCheckBuilder<>("entries.count", (response, session) -> Optional.of(response == null ? 0 : response.size()));
   }

   /**
    * @return Check on the only returned entry.
    */
   public CheckBuilder<Map<K, V>, Map.Entry<K, V>> find() {
      return new CheckBuilder<>("entries.find", onlyEntry("entries.find"));
   }

   /**
    * @param occurrence Zero-based position in the order the entries were returned.
    * @return Check on the entry.
    */
   public CheckBuilder<Map<K, V>, Map.Entry<K, V>> find(int occurrence) {
      return new CheckBuilder<>("entries.find(" + occurrence + ")", (response, session) -> {
         if (response == null) {
            return Optional.empty();
         }
         Iterator<Map.Entry<K, V>> it = response.entrySet().iterator();
         for (int i = 0; it.hasNext(); ++i) {
            Map.Entry<K, V> entry = it.next();
            if (i == occurrence) {
               return Optional.of(entry);
            }
         }
         return Optional.empty();
      });
   }

   /**
    * @param key Key of the entry.
    * @return Check on the value stored under the key.
    */
   public CheckBuilder<Map<K, V>, V> key(K key) {
      return new CheckBuilder<>("entries.key(" + key + ")",
            (response, session) -> response == null ? Optional.empty() : Optional.ofNullable(response.get(key)));
   }

   /**
    * @return Check on the value of the only returned entry.
    */
   public CheckBuilder<Map<K, V>, V> value() {
      return transform(Map.Entry::getValue);
   }

   public CheckBuilder<Map<K, V>, List<Map.Entry<K, V>>> findAll() {
      return new CheckBuilder<>("entries.findAll", (response, session) -> {
         if (response == null || response.isEmpty()) {
            return Optional.empty();
         }
         return Optional.of(new ArrayList<>(response.entrySet()));
      });
   }
}
