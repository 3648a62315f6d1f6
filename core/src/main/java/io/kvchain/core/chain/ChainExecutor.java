package io.kvchain.core.chain;

import io.kvchain.api.session.Session;
import io.kvchain.api.statistics.RequestRecorder;
import io.netty.util.concurrent.EventExecutor;

/**
 * Starts executions of a chain.
 */
public class ChainExecutor {
   private final Chain chain;
   private final RequestRecorder recorder;

   public ChainExecutor(Chain chain) {
      this(chain, RequestRecorder.NOOP);
   }

   public ChainExecutor(Chain chain, RequestRecorder recorder) {
      this.chain = chain;
      this.recorder = recorder;
   }

   public Chain chain() {
      return chain;
   }

   /**
    * Runs the chain for one session. All actions are started from the executor and the chain
    * resumes there after every asynchronous completion.
    *
    * @param session Initial session.
    * @param executor Single-threaded executor the session is pinned to.
    * @return Handle to the running chain.
    */
   public ChainExecution execute(Session session, EventExecutor executor) {
      ChainExecution execution = new ChainExecution(chain, recorder, session, executor);
      execution.start();
      return execution;
   }
}
