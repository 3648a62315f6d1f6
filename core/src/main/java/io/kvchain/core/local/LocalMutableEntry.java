package io.kvchain.core.local;

import io.kvchain.api.client.MutableEntry;

class LocalMutableEntry<K, V> implements MutableEntry<K, V> {
   private final K key;
   private V value;
   private boolean modified;

   LocalMutableEntry(K key, V value) {
      this.key = key;
      this.value = value;
   }

   @Override
   public K getKey() {
      return key;
   }

   @Override
   public V getValue() {
      return value;
   }

   @Override
   public boolean exists() {
      return value != null;
   }

   @Override
   public void setValue(V value) {
      if (value == null) {
         throw new NullPointerException("Use remove() to remove the entry");
      }
      this.value = value;
      this.modified = true;
   }

   @Override
   public void remove() {
      this.value = null;
      this.modified = true;
   }

   boolean isModified() {
      return modified;
   }
}
