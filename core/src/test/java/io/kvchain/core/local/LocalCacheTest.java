package io.kvchain.core.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.kvchain.api.client.CacheApi;
import io.kvchain.api.client.CacheConfiguration;
import io.kvchain.api.client.CacheLock;
import io.kvchain.api.client.ClientException;
import io.kvchain.core.test.TestUtil;

public class LocalCacheTest {
   private LocalCluster cluster;
   private LocalClient client;
   private CacheApi<Integer, String> cache;

   @BeforeEach
   public void before() {
      cluster = new LocalCluster(TestUtil.uniqueClusterName(), 50);
      client = new LocalClient(cluster, true);
      cache = client.getOrCreateCache(CacheConfiguration.named("test"));
   }

   @AfterEach
   public void after() {
      client.close();
   }

   @Test
   public void testBasicOperations() {
      cache.put(1, "one");
      assertThat(cache.get(1)).containsExactly(Map.entry(1, "one"));
      assertThat(cache.get(2)).isEmpty();

      assertThat(cache.getAndPut(1, "uno")).containsExactly(Map.entry(1, "one"));
      assertThat(cache.getAndPut(2, "two")).isEmpty();
      assertThat(cache.getAll(new LinkedHashSet<>(List.of(1, 2, 3)))).containsOnly(Map.entry(1, "uno"), Map.entry(2, "two"));

      assertThat(cache.getAndRemove(1)).containsExactly(Map.entry(1, "uno"));
      assertThat(cache.getAndRemove(1)).isEmpty();

      Map<Integer, String> entries = new LinkedHashMap<>();
      entries.put(3, "three");
      entries.put(4, "four");
      cache.putAll(entries);
      cache.removeAll(new LinkedHashSet<>(List.of(2, 3)));
      assertThat(cluster.content("test")).isEqualTo(Map.of(4, "four"));
   }

   @Test
   public void testNullsRejected() {
      assertThatThrownBy(() -> cache.put(null, "x")).isInstanceOf(ClientException.class);
      assertThatThrownBy(() -> cache.put(1, null)).isInstanceOf(ClientException.class)
            .hasMessage("Null values are not supported");
   }

   @Test
   public void testUndefinedCache() {
      assertThatThrownBy(() -> client.cache("missing"))
            .isInstanceOf(ClientException.class)
            .hasMessage("Cache 'missing' is not a defined cache");
   }

   @Test
   public void testAsyncOperations() throws Exception {
      cache.putAsync(1, "one").get(5, TimeUnit.SECONDS);
      assertThat(cache.getAsync(1).get(5, TimeUnit.SECONDS)).containsExactly(Map.entry(1, "one"));
      assertThat(cache.getAndRemoveAsync(1).get(5, TimeUnit.SECONDS)).containsExactly(Map.entry(1, "one"));
      assertThat(client.getOrCreateCacheAsync(CacheConfiguration.named("other")).get(5, TimeUnit.SECONDS).name()).isEqualTo("other");
   }

   @Test
   public void testInvoke() {
      cache.put(1, "one");
      Map<Integer, String> previous = cache.invoke(1, entry -> {
         String old = entry.getValue();
         entry.setValue(old + "!");
         return old;
      });
      assertThat(previous).containsExactly(Map.entry(1, "one"));
      assertThat(cluster.content("test")).containsEntry(1, "one!");

      Map<Integer, Boolean> existed = cache.invoke(2, entry -> entry.exists());
      assertThat(existed).containsExactly(Map.entry(2, false));

      cache.invoke(1, entry -> {
         entry.remove();
         return null;
      });
      assertThat(cluster.content("test")).isEmpty();

      assertThatThrownBy(() -> cache.invoke(1, entry -> {
         throw new IllegalStateException("boom");
      })).isInstanceOf(ClientException.class).hasMessageContaining("boom");
   }

   @Test
   public void testKeepBinaryView() {
      assertThat(cache.isKeepBinary()).isFalse();
      CacheApi<Integer, String> binary = cache.withKeepBinary();
      assertThat(binary.isKeepBinary()).isTrue();
      binary.put(1, "one");
      assertThat(cache.get(1)).containsEntry(1, "one");
   }

   @Test
   public void testLocks() {
      CacheLock lock = cache.lock(1);
      assertThat(lock.isHeld()).isTrue();
      assertThat(lock.cacheName()).isEqualTo("test");
      assertThatThrownBy(() -> cache.lock(1))
            .isInstanceOf(ClientException.class)
            .hasMessageContaining("Failed to acquire lock for key 1");
      // locks are advisory
      cache.put(1, "one");

      lock.unlock();
      lock.unlock();
      assertThat(lock.isHeld()).isFalse();
      CacheLock again = cache.lock(1);
      again.unlock();
   }

   @Test
   public void testClosedClient() {
      client.close();
      assertThat(client.isClosed()).isTrue();
      assertThatThrownBy(() -> cache.get(1)).isInstanceOf(ClientException.class).hasMessage("Client is closed");
   }
}
