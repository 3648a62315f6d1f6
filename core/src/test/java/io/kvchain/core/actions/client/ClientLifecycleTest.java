package io.kvchain.core.actions.client;

import static io.kvchain.core.check.Checks.entries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import io.kvchain.api.client.ClientApi;
import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Outcome;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.chain.ChainResult;
import io.kvchain.core.local.LocalClient;
import io.kvchain.core.protocol.KvProtocol;
import io.kvchain.core.test.BaseChainTest;
import io.kvchain.core.test.TestUtil;

public class ClientLifecycleTest extends BaseChainTest {

   @Override
   protected KvProtocol createProtocol() {
      return KvProtocol.builder().factory("local").property("cluster", clusterName).explicitClientStart(true).build();
   }

   @Test
   public void testNoClientUntilStarted() {
      ChainResult result = run(ChainBuilder.chain("no-client").get(CACHE).key(1).end());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(result.failure()).isEqualTo("get test: no active client");
   }

   @Test
   public void testStartAndClose() {
      AtomicReference<ClientApi> client = new AtomicReference<>();
      ChainResult result = run(ChainBuilder.chain("start-close")
            .startClient()
            .action(TestUtil.observe("observe", s -> client.set(s.client().orElseThrow())))
            .put(CACHE).key(1).value(1).end()
            .get(CACHE).key(1).check(entries().value().is(1)).end()
            .closeClient()
            .closeClient());

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(result.session().client()).isEmpty();
      assertThat(((LocalClient) client.get()).isClosed()).isTrue();
   }

   @Test
   public void testClientClosedWhenChainEnds() {
      AtomicReference<ClientApi> client = new AtomicReference<>();
      ChainResult result = run(ChainBuilder.chain("dangling")
            .startClient()
            .action(TestUtil.observe("observe", s -> client.set(s.client().orElseThrow())))
            .get("missing").key(1).end());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(((LocalClient) client.get()).isClosed()).isTrue();
   }

   @Test
   public void testStartTwice() {
      ChainResult result = run(ChainBuilder.chain("twice").startClient().startClient());

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(result.failure()).isEqualTo("startClient: client is already started");
   }

   @Test
   public void testRequiresExplicitClientStart() {
      KvProtocol shared = KvProtocol.builder().factory("local").property("cluster", clusterName).build();
      try {
         assertThatThrownBy(() -> ChainBuilder.chain("shared").startClient().build(shared))
               .isInstanceOf(ChainDefinitionException.class)
               .hasMessage("Chain shared: startClient requires a protocol with explicit client start");
         assertThatThrownBy(() -> ChainBuilder.chain("shared").closeClient().build(shared))
               .isInstanceOf(ChainDefinitionException.class);
      } finally {
         shared.close();
      }
   }

   @Test
   public void testProtocolDefinition() {
      assertThatThrownBy(() -> KvProtocol.builder().build())
            .isInstanceOf(ChainDefinitionException.class);
      assertThatThrownBy(() -> KvProtocol.builder().client(protocol.createClient()).explicitClientStart(true).build())
            .isInstanceOf(ChainDefinitionException.class)
            .hasMessage("Explicit client start requires a client factory");
   }
}
