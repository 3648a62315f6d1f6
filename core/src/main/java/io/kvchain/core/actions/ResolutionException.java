package io.kvchain.core.actions;

/**
 * Parameters of an action could not be resolved from the session; the operation was not attempted.
 */
public class ResolutionException extends Exception {
   public ResolutionException(String message) {
      super(message, null, false, false);
   }
}
