package io.kvchain.core.local;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import io.kvchain.api.client.CacheLock;

class LocalLock implements CacheLock {
   private final String cacheName;
   private final Object key;
   private final Semaphore semaphore;
   private final AtomicBoolean held = new AtomicBoolean(true);

   LocalLock(String cacheName, Object key, Semaphore semaphore) {
      this.cacheName = cacheName;
      this.key = key;
      this.semaphore = semaphore;
   }

   @Override
   public Object key() {
      return key;
   }

   @Override
   public String cacheName() {
      return cacheName;
   }

   @Override
   public boolean isHeld() {
      return held.get();
   }

   @Override
   public void unlock() {
      if (held.compareAndSet(true, false)) {
         semaphore.release();
      }
   }

   @Override
   public String toString() {
      return "LocalLock{" + cacheName + ":" + key + (isHeld() ? ", held}" : "}");
   }
}
