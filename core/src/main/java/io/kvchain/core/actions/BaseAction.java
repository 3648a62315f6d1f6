package io.kvchain.core.actions;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.session.Action;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.internal.Properties;

public abstract class BaseAction implements Action {
   private static final boolean STACKTRACE = Properties.getBoolean(Properties.STACKTRACE);

   protected final Logger log = LogManager.getLogger(getClass());
   protected final String actionType;
   protected final String request;

   protected BaseAction(String actionType, String request) {
      this.actionType = actionType;
      this.request = request;
   }

   @Override
   public String name() {
      return request;
   }

   public String actionType() {
      return actionType;
   }

   /**
    * @return Name of the cache, lock or other resource the action works with, or <code>null</code>.
    */
   protected abstract String resource();

   protected CompletionStage<Outcome> resolutionFailed(Session session, ResolutionException e) {
      log.debug("#{} {}: cannot resolve parameters: {}", session.userId(), request, e.getMessage());
      return CompletableFuture.completedFuture(Outcome.fail(session, Outcome.FailureType.RESOLUTION, describe(e.getMessage())));
   }

   protected Outcome operationFailed(Session session, Throwable t) {
      Throwable cause = unwrap(t);
      String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
      if (STACKTRACE) {
         log.warn("#{} {} failed", session.userId(), request, cause);
      } else {
         log.warn("#{} {} failed: {}", session.userId(), request, message);
      }
      return Outcome.fail(session, Outcome.FailureType.OPERATION, describe(message));
   }

   protected Outcome checkFailed(Session session, String message) {
      log.debug("#{} {}: checks failed: {}", session.userId(), request, message);
      return Outcome.fail(session, Outcome.FailureType.CHECK, describe(message));
   }

   protected String describe(String message) {
      String resource = resource();
      return resource == null ? actionType + ": " + message : actionType + " " + resource + ": " + message;
   }

   /**
    * Runs a blocking call, capturing its failure in the returned future.
    */
   protected static <T> CompletableFuture<T> call(Callable<T> call) {
      try {
         return CompletableFuture.completedFuture(call.call());
      } catch (Exception e) {
         return CompletableFuture.failedFuture(e);
      }
   }

   static Throwable unwrap(Throwable t) {
      while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
         t = t.getCause();
      }
      return t;
   }
}
