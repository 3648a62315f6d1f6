package io.kvchain.core.protocol;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.ServiceLoader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.ClientFactory;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Session;
import io.kvchain.api.session.SessionKey;

/**
 * Defines how sessions obtain their client. By default one client is shared by all sessions;
 * with explicit client start every session starts (and owns) its own client.
 */
public class KvProtocol implements AutoCloseable {
   private static final Logger log = LogManager.getLogger(KvProtocol.class);

   private final ClientFactory factory;
   private final Map<String, String> properties;
   private final boolean explicitClientStart;
   private final boolean ownsSharedClient;
   private ClientApi sharedClient;

   private KvProtocol(ClientApi client, ClientFactory factory, Map<String, String> properties, boolean explicitClientStart) {
      this.sharedClient = client;
      this.factory = factory;
      this.properties = properties;
      this.explicitClientStart = explicitClientStart;
      this.ownsSharedClient = client == null;
   }

   public static Builder builder() {
      return new Builder();
   }

   /**
    * Finds client factory registered for the given name.
    *
    * @param name Factory name.
    * @return Factory.
    * @throws ChainDefinitionException if there is no such factory.
    */
   public static ClientFactory factory(String name) {
      for (ClientFactory factory : ServiceLoader.load(ClientFactory.class)) {
         log.debug("Found client factory {}", factory.name());
         if (factory.name().equals(name)) {
            return factory;
         }
      }
      throw new ChainDefinitionException("No client factory registered as '" + name + "'");
   }

   public boolean explicitClientStart() {
      return explicitClientStart;
   }

   /**
    * Starts the shared client unless it was already started or the sessions start their own clients.
    */
   public synchronized void start() {
      if (explicitClientStart || sharedClient != null) {
         return;
      }
      log.info("Starting shared client using factory {}", factory.name());
      sharedClient = factory.create(properties);
   }

   /**
    * @param userId Identifier of the simulated user.
    * @param scenario Name of the chain.
    * @return Fresh session holding the shared client, if there is one.
    */
   public Session newSession(int userId, String scenario) {
      Session session = Session.create(userId, scenario);
      if (explicitClientStart) {
         return session;
      }
      return session.set(SessionKey.CLIENT, sharedClient());
   }

   public synchronized ClientApi sharedClient() {
      if (sharedClient == null) {
         start();
      }
      return sharedClient;
   }

   /**
    * @param client Client found in a session.
    * @return True if the client belongs to the session and should be closed with it.
    */
   public boolean isSessionOwned(ClientApi client) {
      return explicitClientStart && client != null;
   }

   /**
    * Creates a client owned by a single session.
    *
    * @return New client.
    */
   public ClientApi createClient() {
      return factory.create(properties);
   }

   @Override
   public synchronized void close() {
      if (ownsSharedClient && sharedClient != null) {
         log.info("Closing shared client");
         sharedClient.close();
         sharedClient = null;
      }
   }

   public static class Builder {
      private ClientApi client;
      private ClientFactory factory;
      private final Map<String, String> properties = new HashMap<>();
      private boolean explicitClientStart;

      /**
       * Use an already started client shared by all sessions. The protocol does not close it.
       *
       * @param client Client.
       * @return Self.
       */
      public Builder client(ClientApi client) {
         this.client = client;
         return this;
      }

      public Builder factory(ClientFactory factory) {
         this.factory = factory;
         return this;
      }

      /**
       * @param name Name of a factory registered through {@link ServiceLoader}.
       * @return Self.
       */
      public Builder factory(String name) {
         return factory(KvProtocol.factory(name));
      }

      public Builder property(String name, String value) {
         properties.put(name, value);
         return this;
      }

      public Builder properties(Map<String, String> properties) {
         this.properties.putAll(properties);
         return this;
      }

      /**
       * Sessions start their own client with <code>startClient</code>.
       *
       * @param explicitClientStart Enable explicit client start.
       * @return Self.
       */
      public Builder explicitClientStart(boolean explicitClientStart) {
         this.explicitClientStart = explicitClientStart;
         return this;
      }

      public KvProtocol build() {
         if (client != null && factory != null) {
            throw new ChainDefinitionException("Protocol must define either a client or a client factory, not both");
         } else if (client == null && factory == null) {
            throw new ChainDefinitionException("Protocol must define a client or a client factory");
         } else if (explicitClientStart && factory == null) {
            throw new ChainDefinitionException("Explicit client start requires a client factory");
         }
         return new KvProtocol(client, factory, Collections.unmodifiableMap(new HashMap<>(properties)), explicitClientStart);
      }
   }
}
