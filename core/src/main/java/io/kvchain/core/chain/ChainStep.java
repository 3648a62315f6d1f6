package io.kvchain.core.chain;

import io.kvchain.api.session.Action;

/**
 * Action placed in a chain together with the name its statistics are recorded under.
 */
public class ChainStep {
   private final Action action;
   private final String requestName;
   private final int scopeStart;

   /**
    * @param action Action.
    * @param requestName Name of the request including enclosing group names.
    * @param scopeStart Index of the step that opened the scope this step closes, or <code>-1</code>
    *                   if this is not a closing step.
    */
   public ChainStep(Action action, String requestName, int scopeStart) {
      this.action = action;
      this.requestName = requestName;
      this.scopeStart = scopeStart;
   }

   public Action action() {
      return action;
   }

   public String requestName() {
      return requestName;
   }

   public boolean isScopeClose() {
      return scopeStart >= 0;
   }

   /**
    * Closing steps of scopes entered before the failure still run after it.
    *
    * @param lastExecuted Index of the last step that was started.
    * @return True if this step must run after a failure.
    */
   public boolean runsAfterFailure(int lastExecuted) {
      return scopeStart >= 0 && scopeStart <= lastExecuted;
   }

   @Override
   public String toString() {
      return requestName;
   }
}
