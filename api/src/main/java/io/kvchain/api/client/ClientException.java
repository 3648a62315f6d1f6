package io.kvchain.api.client;

/**
 * Failure reported by the capability layer: the cluster rejected or could not complete an operation.
 */
public class ClientException extends RuntimeException {
   public ClientException(String message) {
      super(message);
   }

   public ClientException(String message, Throwable cause) {
      super(message, cause);
   }
}
