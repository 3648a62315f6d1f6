package io.kvchain.core.chain;

import java.util.Collections;
import java.util.List;

import io.kvchain.core.protocol.KvProtocol;

/**
 * Immutable, ordered list of steps executed for every session.
 */
public class Chain {
   private final String name;
   private final KvProtocol protocol;
   private final List<ChainStep> steps;

   public Chain(String name, KvProtocol protocol, List<ChainStep> steps) {
      this.name = name;
      this.protocol = protocol;
      this.steps = Collections.unmodifiableList(steps);
   }

   public String name() {
      return name;
   }

   public KvProtocol protocol() {
      return protocol;
   }

   public List<ChainStep> steps() {
      return steps;
   }

   @Override
   public String toString() {
      return "Chain{" + name + ", steps=" + steps + '}';
   }
}
