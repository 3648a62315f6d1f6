package io.kvchain.core.actions.tx;

import static io.kvchain.core.check.Checks.entries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Outcome;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainResult;
import io.kvchain.core.test.BaseChainTest;

public class TransactionActionsTest extends BaseChainTest {

   @Test
   public void testExplicitTransaction() {
      ChainResult result = run(ChainBuilder.chain("explicit")
            .txStart().timeout(10_000).as("begin").end()
            .put(CACHE).key(1).value("one").end()
            .commit()
            .txClose()
            .get(CACHE).key(1).check(entries().value().is("one")).end());

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(recorder.requests()).containsExactly("begin", "put test", "commit", "txClose", "get test");
   }

   @Test
   public void testStartTwice() {
      ChainResult result = run(ChainBuilder.chain("twice")
            .txStart().end()
            .txStart().end());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(result.failure()).isEqualTo("txStart: transaction is already started");
      // released when the chain ends
      assertThat(result.session().transaction()).isEmpty();
   }

   @Test
   public void testCloseWithoutTransaction() {
      ChainResult result = run(ChainBuilder.chain("close")
            .txClose()
            .txStart().end()
            .txClose()
            .txClose());

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
   }

   @Test
   public void testCommitWithoutTransaction() {
      ChainResult result = run(ChainBuilder.chain("commit").commit());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(result.failure()).isEqualTo("commit: no active transaction");
   }

   @Test
   public void testCommitAfterRollbackKeepsTransaction() {
      ChainResult result = run(ChainBuilder.chain("commit-after-rollback")
            .txStart().end()
            .rollback()
            .commit());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.OPERATION);
      assertThat(result.failure()).isEqualTo("commit: Transaction is rolled back");
      assertThat(result.session().transaction()).isEmpty();
   }

   @Test
   public void testUncommittedTransactionDiscardedAtEnd() {
      ChainResult result = run(ChainBuilder.chain("dangling")
            .txStart().end()
            .put(CACHE).key(1).value("one").end());

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(result.session().transaction()).isEmpty();
      assertThat(cluster.content(CACHE)).isEmpty();
   }

   @Test
   public void testInvalidParameters() {
      assertThatThrownBy(() -> build(ChainBuilder.chain("negative").txStart().size(-1).end()))
            .isInstanceOf(ChainDefinitionException.class)
            .hasMessage("Chain negative: txStart: timeout and size must not be negative");
   }
}
