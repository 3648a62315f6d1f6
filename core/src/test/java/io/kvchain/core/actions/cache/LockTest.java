package io.kvchain.core.actions.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import io.kvchain.api.client.CacheLock;
import io.kvchain.api.session.Outcome;
import io.kvchain.core.chain.Chain;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainResult;
import io.kvchain.core.test.BaseChainTest;
import io.kvchain.core.test.TestUtil;

public class LockTest extends BaseChainTest {

   @Test
   public void testLockAndUnlock() {
      AtomicReference<CacheLock> lock = new AtomicReference<>();
      ChainResult result = run(ChainBuilder.chain("lock")
            .lock(CACHE).key(1).end()
            .action(TestUtil.observe("observe", s -> lock.set((CacheLock) s.attribute("lock").orElseThrow())))
            .put(CACHE).key(1).value("one").end()
            .unlock());

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(lock.get().isHeld()).isFalse();
      assertThat(result.session().attribute("lock")).isEmpty();
      assertThat(result.session().explicitLocksUsed()).contains(true);
      assertThat(recorder.requests()).containsExactly("lock test", "observe", "put test", "unlock lock");
   }

   @Test
   public void testAsyncAfterLockFails() {
      ChainResult result = run(ChainBuilder.chain("async-after-lock")
            .lock(CACHE).key(1).saveAs("l").end()
            .unlock("l")
            .get(CACHE).key(1).async().end());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(result.failure()).contains("Async API can not be used");
   }

   @Test
   public void testLockReleasedWhenChainEnds() {
      AtomicReference<CacheLock> lock = new AtomicReference<>();
      Chain chain = build(ChainBuilder.chain("dangling")
            .lock(CACHE).key("${id}").saveAs("l").end()
            .action(TestUtil.observe("observe", s -> lock.set((CacheLock) s.attribute("l").orElseThrow()))));

      ChainResult first = run(chain, protocol.newSession(0, "dangling").setAttribute("id", 7));
      assertThat(first.isSuccess()).as(first.toString()).isTrue();
      assertThat(lock.get().isHeld()).isFalse();
      assertThat(first.session().attribute("l")).isEmpty();

      // would time out if the lock was still held
      ChainResult second = run(chain, protocol.newSession(1, "dangling").setAttribute("id", 7));
      assertThat(second.isSuccess()).as(second.toString()).isTrue();
   }

   @Test
   public void testLockReleasedAfterFailure() {
      AtomicReference<CacheLock> lock = new AtomicReference<>();
      ChainResult result = run(ChainBuilder.chain("failing")
            .lock(CACHE).key(1).end()
            .action(TestUtil.observe("observe", s -> lock.set((CacheLock) s.attribute("lock").orElseThrow())))
            .get("missing").key(1).end()
            .unlock());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(lock.get().isHeld()).isFalse();
   }

   @Test
   public void testUnlockWithoutLock() {
      ChainResult result = run(ChainBuilder.chain("no-lock").unlock("nothing"));

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(result.failure()).isEqualTo("unlock nothing: no lock saved in variable nothing");
   }

   @Test
   public void testLockVariableTaken() {
      ChainResult result = run(ChainBuilder.chain("taken")
            .lock(CACHE).key(1).end()
            .lock(CACHE).key(2).end());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(result.failure()).isEqualTo("lock test: variable lock is already set");
   }
}
