package io.kvchain.core.check;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import io.kvchain.api.session.Session;

/**
 * Runs checks in declaration order, each one seeing the session produced by the previous.
 * By default all checks run and their failures are aggregated; a strict pipeline stops on the first failure.
 */
public class CheckPipeline<R> implements Serializable {
   private static final CheckPipeline<?> EMPTY = new CheckPipeline<>(List.of(), false);

   private final Check<R>[] checks;
   private final boolean strict;

   @SuppressWarnings("unchecked")
   public CheckPipeline(List<Check<R>> checks, boolean strict) {
      this.checks = checks.toArray(new Check[0]);
      this.strict = strict;
   }

   @SuppressWarnings("unchecked")
   public static <R> CheckPipeline<R> empty() {
      return (CheckPipeline<R>) EMPTY;
   }

   public boolean isEmpty() {
      return checks.length == 0;
   }

   public Session apply(R response, Session session) throws CheckException {
      Session current = session;
      List<String> failures = null;
      for (Check<R> check : checks) {
         try {
            current = invoke(check, response, current);
         } catch (CheckException e) {
            if (strict) {
               throw e;
            }
            if (failures == null) {
               failures = new ArrayList<>();
            }
            failures.add(e.getMessage());
         }
      }
      if (failures != null) {
         throw new CheckException(String.join("; ", failures));
      }
      return current;
   }

   private static <R> Session invoke(Check<R> check, R response, Session session) throws CheckException {
      try {
         return check.check(response, session);
      } catch (RuntimeException e) {
         throw new CheckException(check + ": unexpected error " + e);
      }
   }
}
