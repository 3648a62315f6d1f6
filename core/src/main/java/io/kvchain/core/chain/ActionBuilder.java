package io.kvchain.core.chain;

import io.kvchain.api.session.Action;

/**
 * Mutable definition of an action; produces the immutable action when the chain is built.
 */
public interface ActionBuilder {
   /**
    * @param context Chain being built.
    * @return Action.
    * @throws io.kvchain.api.config.ChainDefinitionException if the definition is invalid.
    */
   Action build(ChainContext context);
}
