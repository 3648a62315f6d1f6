package io.kvchain.core.local;

import java.util.Map;

import org.kohsuke.MetaInfServices;

import io.kvchain.api.client.ClientApi;
import io.kvchain.api.client.ClientFactory;

/**
 * Connects to an in-process {@link LocalCluster}. Properties:
 * <ul>
 *    <li><code>cluster</code>: name of the cluster, <code>default</code> if not set</li>
 *    <li><code>asyncSupported</code>: set to <code>false</code> to emulate a client without async API</li>
 * </ul>
 */
@MetaInfServices(ClientFactory.class)
public class LocalClientFactory implements ClientFactory {
   public static final String NAME = "local";

   @Override
   public String name() {
      return NAME;
   }

   @Override
   public ClientApi create(Map<String, String> properties) {
      LocalCluster cluster = LocalCluster.named(properties.getOrDefault("cluster", "default"));
      boolean asyncSupported = Boolean.parseBoolean(properties.getOrDefault("asyncSupported", "true"));
      return new LocalClient(cluster, asyncSupported);
   }
}
