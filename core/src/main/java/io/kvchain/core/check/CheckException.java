package io.kvchain.core.check;

public class CheckException extends Exception {
   public CheckException(String message) {
      super(message, null, false, false);
   }
}
