package io.kvchain.core.actions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.CacheConfiguration;
import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.TransactionApi;
import io.kvchain.api.client.TransactionParameters;
import io.kvchain.api.session.Session;
import io.kvchain.api.session.SessionKey;
import io.kvchain.core.local.LocalClientFactory;
import io.kvchain.core.local.LocalCluster;
import io.kvchain.core.test.TestUtil;

public class ParameterResolverTest {
   private String clusterName;
   private LocalCluster cluster;
   private ClientApi client;
   private Session session;

   @BeforeEach
   public void before() {
      clusterName = TestUtil.uniqueClusterName();
      cluster = LocalCluster.named(clusterName);
      cluster.getOrCreate(CacheConfiguration.named("test"));
      client = new LocalClientFactory().create(Map.of("cluster", clusterName));
      session = Session.create(0, "resolver").set(SessionKey.CLIENT, client);
   }

   @AfterEach
   public void after() {
      client.close();
      LocalCluster.destroy(clusterName);
   }

   @Test
   public void testNoClient() {
      assertThatThrownBy(() -> ParameterResolver.resolveClient(Session.create(0, "resolver"), false))
            .isInstanceOf(ResolutionException.class)
            .hasMessage(ParameterResolver.NO_CLIENT);
   }

   @Test
   public void testSyncWithTransaction() throws ResolutionException {
      TransactionApi tx = client.txStart(TransactionParameters.DEFAULT);
      Session withTx = session.set(SessionKey.TRANSACTION, tx);

      ParameterResolver.CacheParameters<Integer, String> parameters = ParameterResolver.resolveCache(withTx, "test", false, false);
      assertThat(parameters.transaction()).contains(tx);
      parameters.cache().put(1, "one");
      assertThat(cluster.content("test")).isEmpty();
      tx.commit();
      assertThat(cluster.content("test")).containsEntry(1, "one");
   }

   @Test
   public void testAsyncInTransaction() {
      Session withTx = session.set(SessionKey.TRANSACTION, client.txStart(TransactionParameters.DEFAULT));
      assertThatThrownBy(() -> ParameterResolver.resolveCache(withTx, "test", false, true))
            .isInstanceOf(ResolutionException.class)
            .hasMessage(ParameterResolver.ASYNC_CONFLICT);
   }

   @Test
   public void testAsyncWithExplicitLock() throws ResolutionException {
      assertThatThrownBy(() -> ParameterResolver.resolveClient(session.set(SessionKey.EXPLICIT_LOCK, true), true))
            .isInstanceOf(ResolutionException.class)
            .hasMessage(ParameterResolver.ASYNC_CONFLICT);
      assertThat(ParameterResolver.resolveClient(session.set(SessionKey.EXPLICIT_LOCK, false), true).client()).isSameAs(client);
   }

   @Test
   public void testAsyncUnsupported() {
      ClientApi syncOnly = new LocalClientFactory().create(Map.of("cluster", clusterName, "asyncSupported", "false"));
      Session syncSession = Session.create(0, "resolver").set(SessionKey.CLIENT, syncOnly);
      assertThatThrownBy(() -> ParameterResolver.resolveClient(syncSession, true))
            .isInstanceOf(ResolutionException.class)
            .hasMessage(ParameterResolver.ASYNC_UNSUPPORTED);
   }

   @Test
   public void testMissingCache() {
      assertThatThrownBy(() -> ParameterResolver.resolveCache(session, "missing", false, false))
            .isInstanceOf(ResolutionException.class)
            .hasMessage("Cache 'missing' is not a defined cache");
   }

   @Test
   public void testKeepBinary() throws ResolutionException {
      CacheApi<Object, Object> cache = ParameterResolver.<Object, Object>resolveCache(session, "test", true, true).cache();
      assertThat(cache.isKeepBinary()).isTrue();
      assertThat(cache.name()).isEqualTo("test");
   }
}
