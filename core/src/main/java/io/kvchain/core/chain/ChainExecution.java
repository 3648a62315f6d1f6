package io.kvchain.core.chain;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.client.CacheLock;
import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.session.Session;
import io.kvchain.api.session.SessionKey;
import io.kvchain.api.statistics.RequestRecorder;
import io.netty.util.concurrent.EventExecutor;

/**
 * Single run of a chain for one session. The state is touched only from the session's executor;
 * only the cancellation flag is written from other threads.
 * <p>
 * After the first failure only the closing steps of transaction scopes entered before the failure
 * run. When the chain ends, a transaction, explicit locks and a session-owned client that are
 * still held by the session are released.
 */
public class ChainExecution {
   private static final Logger log = LogManager.getLogger(ChainExecution.class);
   private static final boolean trace = log.isTraceEnabled();

   private final Chain chain;
   private final RequestRecorder recorder;
   private final EventExecutor executor;
   private final CompletableFuture<ChainResult> result = new CompletableFuture<>();
   private volatile boolean cancelled;

   private Session session;
   private int index;
   private int failedAt = -1;
   private Outcome.FailureType failureType;
   private String failure;
   private String failedRequest;
   private boolean finished;

   private CompletableFuture<Outcome> inFlight;
   private ChainStep inFlightStep;
   private long inFlightStartMillis;
   private long inFlightStartNanos;

   ChainExecution(Chain chain, RequestRecorder recorder, Session session, EventExecutor executor) {
      this.chain = chain;
      this.recorder = recorder;
      this.session = session;
      this.executor = executor;
   }

   void start() {
      executor.execute(this::run);
   }

   public CompletableFuture<ChainResult> result() {
      return result;
   }

   public boolean isCancelled() {
      return cancelled;
   }

   /**
    * Abandons the session: the result of a running action is discarded and only closing steps
    * of entered transaction scopes and the release of held resources follow.
    */
   public void cancel() {
      cancelled = true;
      executor.execute(this::onCancel);
   }

   private void onCancel() {
      if (finished || inFlight == null) {
         return;
      }
      ChainStep step = inFlightStep;
      inFlight = null;
      inFlightStep = null;
      log.debug("#{} cancelled while running {}", session.userId(), step.requestName());
      recorder.record(step.requestName(), inFlightStartMillis, System.nanoTime() - inFlightStartNanos,
            Outcome.FailureType.CANCELLED, "cancelled");
      markFailed(index, Outcome.FailureType.CANCELLED, "chain was cancelled", step.requestName());
      index++;
      run();
   }

   private void run() {
      try {
         proceed();
      } catch (Throwable t) {
         log.error("#{} execution of chain {} failed unexpectedly", session.userId(), chain.name(), t);
         finished = true;
         try {
            releaseResources();
         } catch (Throwable releaseError) {
            log.error("#{} failed to release resources of chain {}", session.userId(), chain.name(), releaseError);
            t.addSuppressed(releaseError);
         }
         result.completeExceptionally(t);
      }
   }

   private void proceed() {
      List<ChainStep> steps = chain.steps();
      while (index < steps.size()) {
         if (cancelled && failureType == null) {
            log.debug("#{} cancelled before {}", session.userId(), steps.get(index).requestName());
            markFailed(index - 1, Outcome.FailureType.CANCELLED, "chain was cancelled", null);
         }
         ChainStep step = steps.get(index);
         if (failureType != null && !step.runsAfterFailure(failedAt)) {
            if (trace) {
               log.trace("#{} skipping {}", session.userId(), step.requestName());
            }
            ++index;
            continue;
         }
         long startMillis = System.currentTimeMillis();
         long startNanos = System.nanoTime();
         CompletableFuture<Outcome> future = invoke(step);
         if (future.isDone()) {
            complete(step, future.join(), startMillis, startNanos);
            ++index;
         } else {
            inFlight = future;
            inFlightStep = step;
            inFlightStartMillis = startMillis;
            inFlightStartNanos = startNanos;
            future.whenCompleteAsync((outcome, t) -> resume(future, outcome), executor);
            return;
         }
      }
      finish();
   }

   private CompletableFuture<Outcome> invoke(ChainStep step) {
      Session current = session;
      if (trace) {
         log.trace("#{} invoking {}", current.userId(), step.requestName());
      }
      CompletionStage<Outcome> stage;
      try {
         stage = step.action().execute(current);
      } catch (RuntimeException e) {
         stage = CompletableFuture.failedFuture(e);
      }
      return stage.toCompletableFuture().handle((outcome, t) -> {
         if (t != null) {
            log.error("#{} {} threw unexpectedly", current.userId(), step.requestName(), t);
            return Outcome.fail(current, Outcome.FailureType.OPERATION, "unexpected error: " + t);
         }
         return outcome;
      });
   }

   private void resume(CompletableFuture<Outcome> future, Outcome outcome) {
      if (future != inFlight) {
         if (trace) {
            log.trace("#{} discarding result of a cancelled action: {}", session.userId(), outcome);
         }
         return;
      }
      ChainStep step = inFlightStep;
      inFlight = null;
      inFlightStep = null;
      complete(step, outcome, inFlightStartMillis, inFlightStartNanos);
      ++index;
      run();
   }

   private void complete(ChainStep step, Outcome outcome, long startMillis, long startNanos) {
      long responseTime = System.nanoTime() - startNanos;
      session = outcome.session();
      recorder.record(step.requestName(), startMillis, responseTime, outcome.failureType(), outcome.failure());
      if (!outcome.isFailed()) {
         if (trace) {
            log.trace("#{} {} completed", session.userId(), step.requestName());
         }
      } else if (failureType == null) {
         log.debug("#{} {} failed: {}", session.userId(), step.requestName(), outcome.failure());
         markFailed(index, outcome.failureType(), outcome.failure(), step.requestName());
      } else {
         log.warn("#{} {} failed while finishing after an earlier failure: {}", session.userId(), step.requestName(), outcome.failure());
      }
   }

   private void markFailed(int failedAt, Outcome.FailureType type, String failure, String request) {
      this.failedAt = failedAt;
      this.failureType = type;
      this.failure = failure;
      this.failedRequest = request;
   }

   private void finish() {
      finished = true;
      releaseResources();
      ChainResult chainResult = new ChainResult(chain.name(), session, failureType, failure, failedRequest);
      log.debug("#{} finished: {}", session.userId(), chainResult);
      result.complete(chainResult);
   }

   private void releaseResources() {
      TransactionApi transaction = session.transaction().orElse(null);
      if (transaction != null) {
         log.warn("#{} closing transaction left open by chain {}", session.userId(), chain.name());
         session = session.remove(SessionKey.TRANSACTION);
         try {
            transaction.close();
         } catch (RuntimeException e) {
            releaseFailed("transaction", e);
         }
      }
      for (Map.Entry<String, Object> entry : session.attributes().entrySet()) {
         if (entry.getValue() instanceof CacheLock) {
            CacheLock lock = (CacheLock) entry.getValue();
            session = session.removeAttribute(entry.getKey());
            if (lock.isHeld()) {
               log.warn("#{} releasing lock {} on {} left by chain {}", session.userId(), entry.getKey(), lock.cacheName(), chain.name());
               try {
                  lock.unlock();
               } catch (RuntimeException e) {
                  releaseFailed("lock " + entry.getKey(), e);
               }
            }
         }
      }
      ClientApi client = session.client().orElse(null);
      if (client != null && chain.protocol() != null && chain.protocol().isSessionOwned(client)) {
         log.debug("#{} closing client left open by chain {}", session.userId(), chain.name());
         session = session.remove(SessionKey.CLIENT);
         try {
            client.close();
         } catch (RuntimeException e) {
            releaseFailed("client", e);
         }
      }
   }

   private void releaseFailed(String resource, RuntimeException e) {
      log.error("#{} failed to release {}", session.userId(), resource, e);
      if (failureType == null) {
         markFailed(index, Outcome.FailureType.OPERATION, "failed to release " + resource + ": " + e.getMessage(), null);
      }
   }
}
