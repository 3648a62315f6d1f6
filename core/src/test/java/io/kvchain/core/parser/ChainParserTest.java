package io.kvchain.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Outcome;
import io.kvchain.core.chain.Chain;
import io.kvchain.core.chain.ChainResult;
import io.kvchain.core.impl.ChainRunner;
import io.kvchain.core.local.LocalCluster;
import io.kvchain.core.protocol.KvProtocol;
import io.kvchain.core.test.BaseChainTest;

public class ChainParserTest extends BaseChainTest {

   @Test
   public void testPutGet() throws Exception {
      ChainDefinition definition = load("chains/put-get.yaml");
      assertThat(definition.name()).isEqualTo("put-get");

      ChainResult result = run(definition.build(protocol), protocol.newSession(0, "put-get"));

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(result.session().attribute("balance")).contains(1000);
      assertThat(cluster.content("accounts")).isEmpty();
      assertThat(recorder.requests()).containsExactly(
            "createCache accounts", "put accounts", "get accounts",
            "transfer / txStart", "transfer / getAndPut accounts", "transfer / put accounts", "transfer / commit", "transfer / txClose",
            "verify / getAll accounts", "cleanup", "get accounts", "lock accounts", "unlock lock");
   }

   @Test
   public void testProtocolFromDefinition() throws Exception {
      Chain chain = load("chains/put-get.yaml").build();
      try (ChainRunner runner = new ChainRunner(chain, 1)) {
         List<ChainResult> results = runner.run(1).get(10, TimeUnit.SECONDS);
         assertThat(results).singleElement().matches(ChainResult::isSuccess, "chain succeeded");
      } finally {
         chain.protocol().close();
         LocalCluster.destroy("parser-test");
      }
   }

   @Test
   public void testExplicitClientStart() throws Exception {
      ChainDefinition definition = load("chains/explicit-client.yaml");
      KvProtocol explicit = KvProtocol.builder().factory("local").property("cluster", clusterName).explicitClientStart(true).build();

      ChainResult result = run(definition.build(explicit), explicit.newSession(0, "explicit-client"));

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(result.session().client()).isEmpty();
      assertThat(result.session().attribute("first")).contains(1);
      assertThat(recorder.requests()).contains("commit all");
   }

   @Test
   public void testInvalidCountCondition() {
      assertThatThrownBy(() -> load("chains/invalid-checks.yaml"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("line 7")
            .hasMessageContaining("Cannot parse count condition 'about 3'");
   }

   @Test
   public void testUnknownAction() {
      assertThatThrownBy(() -> ChainParser.instance().parse("name: x\nchain:\n- fly: { cache: c }\n"))
            .isInstanceOf(ParserException.class)
            .hasMessageStartingWith("line 3, column 3: Unknown action 'fly'")
            .satisfies(e -> {
               assertThat(((ParserException) e).line()).isEqualTo(3);
               assertThat(((ParserException) e).column()).isEqualTo(3);
            });
      assertThatThrownBy(() -> ChainParser.instance().parse("name: x\nchain:\n- get\n"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("Action 'get' requires parameters");
   }

   @Test
   public void testMisindentedAction() {
      String yaml = "name: x\n" +
            "chain:\n" +
            "- get:\n" +
            "    cache: c\n" +
            "  key: 1\n";
      assertThatThrownBy(() -> ChainParser.instance().parse(yaml))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("single-key mapping");
   }

   @Test
   public void testUnknownProperty() {
      assertThatThrownBy(() -> ChainParser.instance().parse("name: x\nchain:\n- put: { cache: c, key: 1, velue: 2 }\n"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("Invalid configuration label: 'velue'");
   }

   @Test
   public void testUnknownFactory() {
      assertThatThrownBy(() -> ChainParser.instance().parse("name: x\nprotocol:\n  factory: nope\nchain: []\n"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("No client factory registered as 'nope'");
   }

   @Test
   public void testMalformedYaml() {
      assertThatThrownBy(() -> ChainParser.instance().parse("name: x\nchain:\n- put: { cache: c\n"))
            .isInstanceOf(ParserException.class);
   }

   @Test
   public void testIncompleteActionFailsBuild() throws ParserException {
      ChainDefinition definition = ChainParser.instance().parse("name: incomplete\nchain:\n- put: { cache: c, key: 1 }\n");
      assertThatThrownBy(() -> definition.build(protocol))
            .isInstanceOf(ChainDefinitionException.class)
            .hasMessage("Chain incomplete: put c: value is not set");
      assertThatThrownBy(definition::build)
            .isInstanceOf(ChainDefinitionException.class)
            .hasMessageContaining("protocol is not defined");
   }

   @Test
   public void testQuotedValuesStayStrings() throws ParserException {
      ChainDefinition definition = ChainParser.instance().parse("name: quoted\n" +
            "chain:\n" +
            "- put: { cache: test, key: \"1\", value: \"true\" }\n" +
            "- get: { cache: test, key: 1, checks: [ notExists ] }\n" +
            "- get: { cache: test, key: \"1\", checks: [ { value: \"true\" } ] }\n");

      ChainResult result = run(definition.build(protocol), protocol.newSession(0, "quoted"));

      assertThat(result.isSuccess()).as(result.toString()).isTrue();
      assertThat(cluster.content(CACHE)).containsEntry("1", "true");
   }

   @Test
   public void testFailingChainFromYaml() throws ParserException {
      ChainDefinition definition = ChainParser.instance().parse("name: failing\n" +
            "chain:\n" +
            "- transaction:\n" +
            "    chain:\n" +
            "    - put: { cache: test, key: 1, value: 1 }\n" +
            "    - get: { cache: test, key: 1, async: true }\n" +
            "    - commit\n");

      ChainResult result = run(definition.build(protocol), protocol.newSession(0, "failing"));

      assertThat(result.failureType()).isEqualTo(Outcome.FailureType.RESOLUTION);
      assertThat(cluster.content(CACHE)).isEmpty();
      assertThat(recorder.requests()).containsExactly("txStart", "put test", "get test", "txClose");
   }

   private ChainDefinition load(String resource) throws IOException, ParserException {
      try (InputStream stream = getClass().getClassLoader().getResourceAsStream(resource)) {
         assertThat(stream).as(resource).isNotNull();
         return ChainParser.instance().parse(stream);
      }
   }
}
