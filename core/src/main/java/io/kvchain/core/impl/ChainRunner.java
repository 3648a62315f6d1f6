package io.kvchain.core.impl;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.kvchain.api.session.Session;
import io.kvchain.core.chain.Chain;
import io.kvchain.core.chain.ChainExecution;
import io.kvchain.core.chain.ChainExecutor;
import io.kvchain.core.chain.ChainResult;
import io.kvchain.core.statistics.StatisticsCollector;
import io.kvchain.internal.Properties;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * Runs a chain for a number of concurrent sessions, each pinned to one executor of the group.
 */
public class ChainRunner implements AutoCloseable {
   private static final Logger log = LogManager.getLogger(ChainRunner.class);

   private final Chain chain;
   private final EventExecutorGroup executors;
   private final StatisticsCollector statistics = new StatisticsCollector();
   private final ChainExecutor chainExecutor;

   public ChainRunner(Chain chain) {
      this(chain, Properties.getInt(Properties.THREADS, Runtime.getRuntime().availableProcessors()));
   }

   public ChainRunner(Chain chain, int threads) {
      this.chain = chain;
      this.executors = new DefaultEventExecutorGroup(threads, new DefaultThreadFactory("kvchain-" + chain.name(), true));
      this.chainExecutor = new ChainExecutor(chain, statistics);
   }

   public CompletableFuture<List<ChainResult>> run(int users) {
      return run(users, null);
   }

   /**
    * @param users Number of sessions.
    * @param timeout Sessions not finished within this time are cancelled; <code>null</code> for no timeout.
    * @return Results in the order of user ids.
    */
   public CompletableFuture<List<ChainResult>> run(int users, Duration timeout) {
      if (users <= 0) {
         throw new IllegalArgumentException("Number of users must be positive: " + users);
      }
      chain.protocol().start();
      log.info("Starting {} sessions of chain {}", users, chain.name());
      List<CompletableFuture<ChainResult>> futures = new ArrayList<>(users);
      for (int userId = 0; userId < users; ++userId) {
         Session session = chain.protocol().newSession(userId, chain.name());
         EventExecutor executor = executors.next();
         ChainExecution execution = chainExecutor.execute(session, executor);
         if (timeout != null) {
            ScheduledFuture<?> timer = executor.schedule(execution::cancel, timeout.toMillis(), TimeUnit.MILLISECONDS);
            execution.result().whenComplete((result, t) -> timer.cancel(false));
         }
         futures.add(execution.result());
      }
      return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).thenApply(nil -> {
         List<ChainResult> results = new ArrayList<>(users);
         for (CompletableFuture<ChainResult> future : futures) {
            results.add(future.join());
         }
         long failed = results.stream().filter(r -> !r.isSuccess()).count();
         log.info("Chain {} finished, {} of {} sessions failed", chain.name(), failed, users);
         return results;
      });
   }

   public StatisticsCollector statistics() {
      return statistics;
   }

   @Override
   public void close() {
      executors.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
   }
}
