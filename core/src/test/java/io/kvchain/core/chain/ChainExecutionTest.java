package io.kvchain.core.chain;

import static io.kvchain.core.check.Checks.entries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import io.kvchain.api.client.ClientException;
import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.session.Outcome;
import io.kvchain.api.statistics.RequestRecorder;
import io.kvchain.core.test.BaseChainTest;
import io.kvchain.core.test.RecordingRecorder;
import io.kvchain.core.test.TestUtil;

public class ChainExecutionTest extends BaseChainTest {

   @Test
   public void testSessionIsThreadedThroughActions() {
      ChainResult result = run(ChainBuilder.chain("threaded")
            .put(CACHE).key(1).value("first").end()
            .get(CACHE).key(1).check(entries().value().saveAs("v")).end()
            .put(CACHE).key("${v}").value(2).end()
            .get(CACHE).key("first").check(entries().value().is(2)).end());

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(result.chainName()).isEqualTo("threaded");
   }

   @Test
   public void testAsyncActionsResumeOnExecutor() {
      List<Boolean> inEventLoop = Collections.synchronizedList(new ArrayList<>());
      ChainResult result = run(ChainBuilder.chain("async")
            .put(CACHE).key(1).value(1).async().end()
            .action(TestUtil.observe("after put", s -> inEventLoop.add(executor.inEventLoop())))
            .get(CACHE).key(1).async().check(entries().exists()).end()
            .action(TestUtil.observe("after get", s -> inEventLoop.add(executor.inEventLoop()))));

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(inEventLoop).containsExactly(true, true);
      assertThat(recorder.requests()).containsExactly("put test", "after put", "get test", "after get");
   }

   @Test
   public void testGroupsPrefixRequestNames() {
      ChainResult result = run(ChainBuilder.chain("groups")
            .group("outer", outer -> outer
                  .put(CACHE).key(1).value(1).end()
                  .group("inner", inner -> inner.get(CACHE).key(1).as("read").end()))
            .remove(CACHE).key(1).end());

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(recorder.requests()).containsExactly("outer / put test", "outer / inner / read", "remove test");
   }

   @Test
   public void testUnexpectedExceptionFailsOperation() {
      ChainResult result = run(ChainBuilder.chain("throwing")
            .action(TestUtil.action("broken", s -> {
               throw new IllegalStateException("broken action");
            }))
            .put(CACHE).key(1).value(1).end());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.OPERATION);
      assertThat(result.failedRequest()).isEqualTo("broken");
      assertThat(result.failure()).contains("broken action");
      assertThat(cluster.content(CACHE)).isEmpty();
   }

   @Test
   public void testCancelRunningAction() throws InterruptedException {
      CountDownLatch started = new CountDownLatch(1);
      CompletableFuture<Outcome> never = new CompletableFuture<>();
      ChainExecution execution = start(ChainBuilder.chain("cancelled")
            .transaction().as("tx").run(tx -> tx
                  .put(CACHE).key(1).value(1).end()
                  .action(TestUtil.action("hang", s -> {
                     started.countDown();
                     return never;
                  }))
                  .commit())
            .put(CACHE).key(2).value(2).end());

      assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
      execution.cancel();
      ChainResult result = await(execution);

      assertThat(execution.isCancelled()).isTrue();
      assertThat(result.isCancelled()).isTrue();
      assertThat(result.failedRequest()).isEqualTo("tx / hang");
      assertThat(result.session().transaction()).isEmpty();
      assertThat(cluster.content(CACHE)).isEmpty();
      assertThat(recorder.records()).extracting(r -> r.requestName + ":" + r.failureType)
            .containsExactly("tx / txStart:null", "tx / put test:null", "tx / hang:CANCELLED", "tx / txClose:null");

      // late completion of the abandoned action is ignored
      never.complete(Outcome.proceed(result.session()));
      assertThat(recorder.records()).hasSize(4);
   }

   @Test
   public void testCancelBeforeStart() {
      ChainExecution execution = new ChainExecutor(build(ChainBuilder.chain("early").put(CACHE).key(1).value(1).end()), new RecordingRecorder())
            .execute(protocol.newSession(0, "early"), executor);
      execution.cancel();
      ChainResult result = await(execution);

      // the put may win the race with the cancellation
      if (result.isCancelled()) {
         assertThat(cluster.content(CACHE)).isEmpty();
      } else {
         assertThat(result.isSuccess()).isTrue();
      }
   }

   @Test
   public void testUnexpectedFailureReleasesTransaction() throws InterruptedException {
      AtomicReference<TransactionApi> transaction = new AtomicReference<>();
      Chain chain = build(ChainBuilder.chain("recorder")
            .transaction().as("tx").run(tx -> tx
                  .put(CACHE).key(1).value(1).end()
                  .action(TestUtil.observe("capture", s -> transaction.set(s.transaction().orElseThrow())))
                  .commit()));
      RequestRecorder failing = (requestName, startTimestampMillis, responseTimeNanos, failureType, message) -> {
         if (requestName.equals("tx / capture")) {
            throw new IllegalStateException("recorder is broken");
         }
      };
      ChainExecution execution = new ChainExecutor(chain, failing).execute(protocol.newSession(0, "recorder"), executor);

      assertThatThrownBy(() -> execution.result().get(10, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasRootCauseMessage("recorder is broken");
      assertThat(transaction.get()).isNotNull();
      assertThatThrownBy(() -> transaction.get().commit())
            .isInstanceOf(ClientException.class)
            .hasMessage("Transaction is closed");
      assertThat(cluster.content(CACHE)).isEmpty();
   }
}
