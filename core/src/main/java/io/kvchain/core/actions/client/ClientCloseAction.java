package io.kvchain.core.actions.client;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.kvchain.api.client.ClientApi;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Action;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.api.session.SessionKey;
import io.kvchain.core.actions.BaseAction;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainContext;

/**
 * Closes the client owned by the session. Without a client this is a no-op.
 */
public class ClientCloseAction extends BaseAction {

   public ClientCloseAction(String request) {
      super("closeClient", request);
   }

   @Override
   protected String resource() {
      return null;
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      ClientApi client = session.client().orElse(null);
      if (client == null) {
         return CompletableFuture.completedFuture(Outcome.proceed(session));
      }
      Session withoutClient = session.remove(SessionKey.CLIENT);
      try {
         client.close();
      } catch (RuntimeException e) {
         return CompletableFuture.completedFuture(operationFailed(withoutClient, e));
      }
      log.debug("#{} closed client", session.userId());
      return CompletableFuture.completedFuture(Outcome.proceed(withoutClient));
   }

   public static class Builder implements ActionBuilder {
      private String name;

      public Builder as(String name) {
         this.name = name;
         return this;
      }

      @Override
      public Action build(ChainContext context) {
         if (context.protocol() == null || !context.protocol().explicitClientStart()) {
            throw new ChainDefinitionException(context.chainName(), "closeClient requires a protocol with explicit client start");
         }
         return new ClientCloseAction(name != null ? name : "closeClient");
      }
   }
}
