package io.kvchain.api.client;

public interface MutableEntry<K, V> {

   K getKey();

   V getValue();

   boolean exists();

   void setValue(V value);

   void remove();
}
