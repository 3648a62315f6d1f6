package io.kvchain.api.session;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.TransactionApi;

/**
 * Per-user state threaded through a chain of actions. Instances are immutable: every update
 * returns a new session and leaves the original untouched, therefore a session can be handed
 * over between threads without further synchronization.
 */
public final class Session {
   private final int userId;
   private final String scenario;
   private final Map<SessionKey<?>, Object> values;

   private Session(int userId, String scenario, Map<SessionKey<?>, Object> values) {
      this.userId = userId;
      this.scenario = scenario;
      this.values = values;
   }

   public static Session create(int userId, String scenario) {
      return new Session(userId, scenario, Collections.emptyMap());
   }

   /**
    * @return int &gt;= 0 identifying the simulated user
    */
   public int userId() {
      return userId;
   }

   public String scenario() {
      return scenario;
   }

   public <T> Optional<T> get(SessionKey<T> key) {
      return Optional.ofNullable(key.cast(values.get(key)));
   }

   public boolean contains(SessionKey<?> key) {
      return values.containsKey(key);
   }

   public <T> Session set(SessionKey<T> key, T value) {
      if (value == null) {
         return remove(key);
      }
      Map<SessionKey<?>, Object> copy = new HashMap<>(values);
      copy.put(key, value);
      return new Session(userId, scenario, Collections.unmodifiableMap(copy));
   }

   public Session remove(SessionKey<?> key) {
      if (!values.containsKey(key)) {
         return this;
      }
      Map<SessionKey<?>, Object> copy = new HashMap<>(values);
      copy.remove(key);
      return new Session(userId, scenario, Collections.unmodifiableMap(copy));
   }

   public Optional<ClientApi> client() {
      return get(SessionKey.CLIENT);
   }

   public Optional<TransactionApi> transaction() {
      return get(SessionKey.TRANSACTION);
   }

   public Optional<Boolean> explicitLocksUsed() {
      return get(SessionKey.EXPLICIT_LOCK);
   }

   public Optional<Object> attribute(String name) {
      return get(SessionKey.saved(name));
   }

   public Session setAttribute(String name, Object value) {
      return set(SessionKey.saved(name), value);
   }

   public Session setAttributes(Map<String, ?> attributes) {
      Map<SessionKey<?>, Object> copy = new HashMap<>(values);
      attributes.forEach((name, value) -> {
         if (value == null) {
            copy.remove(SessionKey.saved(name));
         } else {
            copy.put(SessionKey.saved(name), value);
         }
      });
      return new Session(userId, scenario, Collections.unmodifiableMap(copy));
   }

   public Session removeAttribute(String name) {
      return remove(SessionKey.saved(name));
   }

   /**
    * @return Values saved under user-defined names.
    */
   public Map<String, Object> attributes() {
      Map<String, Object> attributes = new LinkedHashMap<>();
      values.forEach((key, value) -> {
         if (key.slot() == SessionKey.Slot.SAVED) {
            attributes.put(key.name(), value);
         }
      });
      return attributes;
   }

   @Override
   public String toString() {
      return "Session{#" + userId + ", scenario='" + scenario + "', " + values + '}';
   }
}
