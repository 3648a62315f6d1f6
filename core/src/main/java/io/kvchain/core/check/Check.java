package io.kvchain.core.check;

import java.io.Serializable;

import io.kvchain.api.session.Session;

/**
 * Assertion or extraction applied to the result of an operation.
 *
 * @param <R> Type of the operation result.
 */
@FunctionalInterface
public interface Check<R> extends Serializable {
   /**
    * @param response Result of the operation.
    * @param session Session after the operation.
    * @return Session, possibly with values saved by this check.
    * @throws CheckException if the result does not pass the check.
    */
   Session check(R response, Session session) throws CheckException;
}
