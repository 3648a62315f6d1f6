package io.kvchain.core.actions.cache;

public enum CacheOperation {
   /**
    * Stores the value under the key.
    */
   PUT("put"),
   /**
    * Stores all entries of a map.
    */
   PUT_ALL("putAll"),
   /**
    * Retrieves entry for the key.
    */
   GET("get"),
   /**
    * Retrieves entries for all given keys.
    */
   GET_ALL("getAll"),
   /**
    * Stores the value and returns the previous entry.
    */
   GET_AND_PUT("getAndPut"),
   /**
    * Removes the entry and returns it.
    */
   GET_AND_REMOVE("getAndRemove"),
   REMOVE("remove"),
   REMOVE_ALL("removeAll"),
   /**
    * Runs an entry processor against the entry.
    */
   INVOKE("invoke");

   private final String verb;

   CacheOperation(String verb) {
      this.verb = verb;
   }

   public String verb() {
      return verb;
   }

   public static CacheOperation fromVerb(String verb) {
      for (CacheOperation operation : values()) {
         if (operation.verb.equals(verb)) {
            return operation;
         }
      }
      throw new IllegalArgumentException("Unknown cache operation: " + verb);
   }
}
