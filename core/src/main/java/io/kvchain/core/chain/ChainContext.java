package io.kvchain.core.chain;

import io.kvchain.core.protocol.KvProtocol;

public class ChainContext {
   private final String chainName;
   private final KvProtocol protocol;

   public ChainContext(String chainName, KvProtocol protocol) {
      this.chainName = chainName;
      this.protocol = protocol;
   }

   public String chainName() {
      return chainName;
   }

   public KvProtocol protocol() {
      return protocol;
   }
}
