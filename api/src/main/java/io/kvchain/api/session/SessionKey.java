package io.kvchain.api.session;

import java.io.Serializable;
import java.util.Objects;

import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.TransactionApi;

/**
 * Typed address of a value stored in the {@link Session}.
 *
 * @param <T> Type of the stored value.
 */
public final class SessionKey<T> implements Serializable {
   public static final SessionKey<ClientApi> CLIENT = new SessionKey<>(Slot.CLIENT, "client", ClientApi.class);
   public static final SessionKey<TransactionApi> TRANSACTION = new SessionKey<>(Slot.TRANSACTION, "transaction", TransactionApi.class);
   public static final SessionKey<Boolean> EXPLICIT_LOCK = new SessionKey<>(Slot.EXPLICIT_LOCK, "explicitLockWasUsed", Boolean.class);

   private final Slot slot;
   private final String name;
   private final Class<T> type;

   private SessionKey(Slot slot, String name, Class<T> type) {
      this.slot = slot;
      this.name = name;
      this.type = type;
   }

   /**
    * Key for a value saved by a check or an action under a user-provided name.
    *
    * @param name Variable name.
    * @return Session key.
    */
   public static SessionKey<Object> saved(String name) {
      if (name == null || name.isEmpty()) {
         throw new IllegalArgumentException("Variable name must not be empty");
      }
      return new SessionKey<>(Slot.SAVED, name, Object.class);
   }

   public Slot slot() {
      return slot;
   }

   public String name() {
      return name;
   }

   T cast(Object value) {
      return type.cast(value);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      } else if (o == null || getClass() != o.getClass()) {
         return false;
      }
      SessionKey<?> that = (SessionKey<?>) o;
      return slot == that.slot && name.equals(that.name);
   }

   @Override
   public int hashCode() {
      return Objects.hash(slot, name);
   }

   @Override
   public String toString() {
      return slot == Slot.SAVED ? name : slot.name();
   }

   public enum Slot {
      /**
       * Active client handle.
       */
      CLIENT,
      /**
       * Transaction started by the chain and not closed yet.
       */
      TRANSACTION,
      /**
       * Set once an explicit lock was taken; vetoes the async API.
       */
      EXPLICIT_LOCK,
      /**
       * Values saved under user-defined names.
       */
      SAVED
   }
}
