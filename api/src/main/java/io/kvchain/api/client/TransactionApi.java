package io.kvchain.api.client;

/**
 * Handle to a transaction started by {@link ClientApi#txStart(TransactionParameters)}.
 * Every method throws {@link ClientException} on failure.
 */
public interface TransactionApi extends AutoCloseable {

   void commit();

   void rollback();

   /**
    * Ends the transaction. Writes that were not committed are discarded. Closing an already
    * closed transaction has no effect.
    */
   @Override
   void close();

   TransactionParameters parameters();
}
