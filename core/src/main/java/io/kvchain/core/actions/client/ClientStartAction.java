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
import io.kvchain.core.actions.ResolutionException;
import io.kvchain.core.chain.ActionBuilder;
import io.kvchain.core.chain.ChainContext;
import io.kvchain.core.protocol.KvProtocol;

/**
 * Starts a client owned by the session.
 */
public class ClientStartAction extends BaseAction {
   private final KvProtocol protocol;

   public ClientStartAction(String request, KvProtocol protocol) {
      super("startClient", request);
      this.protocol = protocol;
   }

   @Override
   protected String resource() {
      return null;
   }

   @Override
   public CompletionStage<Outcome> execute(Session session) {
      if (session.client().isPresent()) {
         return resolutionFailed(session, new ResolutionException("client is already started"));
      }
      ClientApi client;
      try {
         client = protocol.createClient();
      } catch (RuntimeException e) {
         return CompletableFuture.completedFuture(operationFailed(session, e));
      }
      log.debug("#{} started client", session.userId());
      return CompletableFuture.completedFuture(Outcome.proceed(session.set(SessionKey.CLIENT, client)));
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
            throw new ChainDefinitionException(context.chainName(), "startClient requires a protocol with explicit client start");
         }
         return new ClientStartAction(name != null ? name : "startClient", context.protocol());
      }
   }
}
