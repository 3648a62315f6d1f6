package io.kvchain.core.parser;

import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.core.chain.Chain;
import io.kvchain.core.chain.ChainBuilder;
import io.kvchain.core.protocol.KvProtocol;

/**
 * Parsed but not yet built chain definition.
 */
public class ChainDefinition {
   private final ChainBuilder chain = ChainBuilder.chain("chain");
   private KvProtocol.Builder protocol;
   private String name;

   void name(String name) {
      this.name = name;
   }

   public String name() {
      return name;
   }

   public ChainBuilder chain() {
      return chain;
   }

   KvProtocol.Builder protocol() {
      if (protocol == null) {
         protocol = KvProtocol.builder();
      }
      return protocol;
   }

   /**
    * Builds the chain with the protocol from the definition.
    *
    * @return Chain.
    */
   public Chain build() {
      if (protocol == null) {
         throw new ChainDefinitionException(name, "protocol is not defined");
      }
      return build(protocol.build());
   }

   /**
    * Builds the chain with a protocol provided by the caller; the protocol section is ignored.
    *
    * @param protocol Protocol.
    * @return Chain.
    */
   public Chain build(KvProtocol protocol) {
      if (name == null || name.isEmpty()) {
         throw new ChainDefinitionException("Chain definition has no name");
      }
      return chain.build(name, protocol);
   }
}
