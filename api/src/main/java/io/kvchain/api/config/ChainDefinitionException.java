package io.kvchain.api.config;

/**
 * Thrown when a chain cannot be built from its definition.
 */
public class ChainDefinitionException extends RuntimeException {
   public ChainDefinitionException(String msg) {
      super(msg);
   }

   public ChainDefinitionException(String msg, Throwable cause) {
      super(msg, cause);
   }

   public ChainDefinitionException(String chain, String msg) {
      super(String.format("Chain %s: %s", chain, msg));
   }
}
