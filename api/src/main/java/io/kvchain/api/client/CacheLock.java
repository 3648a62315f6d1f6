package io.kvchain.api.client;

/**
 * Explicit lock acquired through {@link CacheApi#lock(Object)}.
 */
public interface CacheLock {

   Object key();

   String cacheName();

   boolean isHeld();

   /**
    * Releases the lock; releasing a lock that is not held has no effect.
    */
   void unlock();
}
