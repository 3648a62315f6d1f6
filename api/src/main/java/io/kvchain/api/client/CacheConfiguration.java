package io.kvchain.api.client;

import java.io.Serializable;
import java.util.Objects;

public class CacheConfiguration implements Serializable {
   private final String name;
   private final int backups;
   private final CacheAtomicity atomicity;
   private final CacheMode mode;

   public CacheConfiguration(String name, int backups, CacheAtomicity atomicity, CacheMode mode) {
      this.name = Objects.requireNonNull(name, "Cache name must be set");
      if (backups < 0) {
         throw new IllegalArgumentException("Number of backups must not be negative: " + backups);
      }
      this.backups = backups;
      this.atomicity = atomicity;
      this.mode = mode;
   }

   public static CacheConfiguration named(String name) {
      return new CacheConfiguration(name, 0, CacheAtomicity.ATOMIC, CacheMode.PARTITIONED);
   }

   public String name() {
      return name;
   }

   public int backups() {
      return backups;
   }

   public CacheAtomicity atomicity() {
      return atomicity;
   }

   public CacheMode mode() {
      return mode;
   }

   @Override
   public String toString() {
      return "CacheConfiguration{name='" + name + "', backups=" + backups + ", atomicity=" + atomicity + ", mode=" + mode + '}';
   }
}
