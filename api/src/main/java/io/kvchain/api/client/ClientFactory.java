package io.kvchain.api.client;

import java.util.Map;

/**
 * Creates clients for a named cluster binding. Implementations are discovered through
 * {@link java.util.ServiceLoader}.
 */
public interface ClientFactory {

   String name();

   ClientApi create(Map<String, String> properties);
}
