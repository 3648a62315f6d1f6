package io.kvchain.api.session;

import java.util.concurrent.CompletionStage;

/**
 * Unit of work in a chain. Implementations must not throw from {@link #execute(Session)}:
 * any failure is reported through a failed {@link Outcome}.
 */
public interface Action {

   /**
    * @return Name under which the action is reported.
    */
   String name();

   /**
    * @param session Current session, owned exclusively by the calling chain.
    * @return Stage completed with the outcome; the chain does not continue until it completes.
    */
   CompletionStage<Outcome> execute(Session session);
}
