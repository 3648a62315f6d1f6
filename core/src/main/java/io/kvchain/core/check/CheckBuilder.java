package io.kvchain.core.check;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

import io.kvchain.api.session.Session;
import io.kvchain.function.SerializableBiPredicate;
import io.kvchain.function.SerializableFunction;

/**
 * Check composed of an extraction, optional transformations, a validation and optionally saving
 * the extracted value into the session. Every method returns a new instance.
 * <p>
 * Without explicit validation the check requires the extracted value to exist, unless
 * {@link #saveAs(String)} is used: saving alone never fails.
 *
 * @param <R> Type of the operation result.
 * @param <X> Type of the extracted value.
 */
public class CheckBuilder<R, X> implements Check<R> {
   protected final String description;
   protected final Extractor<R, X> extractor;
   protected final Validator<X> validator;
   protected final String saveAs;

   public CheckBuilder(String description, Extractor<R, X> extractor) {
      this(description, extractor, null, null);
   }

   protected CheckBuilder(String description, Extractor<R, X> extractor, Validator<X> validator, String saveAs) {
      this.description = description;
      this.extractor = extractor;
      this.validator = validator;
      this.saveAs = saveAs;
   }

   protected CheckBuilder<R, X> validate(String name, Validator<X> validator) {
      return new CheckBuilder<>(description + "." + name, extractor, validator, saveAs);
   }

   public <Y> CheckBuilder<R, Y> transform(SerializableFunction<X, Y> transform) {
      Extractor<R, X> extractor = this.extractor;
      return new CheckBuilder<>(description + ".transform", (response, session) -> {
         Optional<X> value = extractor.extract(response, session);
         try {
            return value.map(transform);
         } catch (RuntimeException e) {
            throw new CheckException(description + ".transform failed: " + e);
         }
      });
   }

   /**
    * The extracted value must exist.
    *
    * @return Check.
    */
   public CheckBuilder<R, X> exists() {
      return validate("exists", (actual, session) -> actual.isPresent() ? null : "found nothing");
   }

   /**
    * The extracted value must not exist.
    *
    * @return Check.
    */
   public CheckBuilder<R, X> notExists() {
      return validate("notExists", (actual, session) -> actual.isEmpty() ? null : "found " + actual.get());
   }

   /**
    * The value must be absent or <code>null</code>.
    *
    * @return Check.
    */
   public CheckBuilder<R, X> isNull() {
      return validate("isNull", (actual, session) -> actual.isEmpty() ? null : "found " + actual.get());
   }

   public CheckBuilder<R, X> is(X expected) {
      return validate("is(" + expected + ")", (actual, session) -> compare(expected, actual));
   }

   /**
    * The value must be equal to the one computed from the session.
    *
    * @param expected Function computing the expected value.
    * @return Check.
    */
   public CheckBuilder<R, X> is(SerializableFunction<Session, X> expected) {
      return validate("is", (actual, session) -> {
         X expectedValue;
         try {
            expectedValue = expected.apply(session);
         } catch (RuntimeException e) {
            return "cannot compute expected value: " + e.getMessage();
         }
         return compare(expectedValue, actual);
      });
   }

   public CheckBuilder<R, X> not(X unexpected) {
      return validate("not(" + unexpected + ")", (actual, session) ->
            actual.isPresent() && Objects.equals(actual.get(), unexpected) ? "found " + unexpected : null);
   }

   public CheckBuilder<R, X> validate(SerializableBiPredicate<X, Session> predicate) {
      return validate("validate", (actual, session) -> {
         if (actual.isEmpty()) {
            return "found nothing";
         }
         try {
            return predicate.test(actual.get(), session) ? null : "validation failed for " + actual.get();
         } catch (RuntimeException e) {
            return "validation of " + actual.get() + " threw " + e;
         }
      });
   }

   /**
    * Save the extracted value into session variable. Nothing is saved when the value does not exist.
    *
    * @param var Variable name.
    * @return Check.
    */
   public CheckBuilder<R, X> saveAs(String var) {
      return new CheckBuilder<>(description, extractor, validator, var);
   }

   @Override
   public Session check(R response, Session session) throws CheckException {
      Optional<X> actual = extractor.extract(response, session);
      Validator<X> validator = this.validator;
      String description = this.description;
      if (validator == null && saveAs == null) {
         validator = (value, s) -> value.isPresent() ? null : "found nothing";
         description += ".exists";
      }
      if (validator != null) {
         String mismatch = validator.validate(actual, session);
         if (mismatch != null) {
            throw new CheckException(description + ": " + mismatch);
         }
      }
      if (saveAs != null && actual.isPresent()) {
         return session.setAttribute(saveAs, actual.get());
      }
      return session;
   }

   private static <X> String compare(X expected, Optional<X> actual) {
      if (actual.isEmpty()) {
         return "expected " + expected + " but found nothing";
      } else if (!Objects.equals(expected, actual.get())) {
         return "expected " + expected + " but found " + actual.get();
      }
      return null;
   }

   @Override
   public String toString() {
      return saveAs == null ? description : description + ".saveAs(" + saveAs + ")";
   }

   @FunctionalInterface
   public interface Extractor<R, X> extends Serializable {
      Optional<X> extract(R response, Session session) throws CheckException;
   }

   @FunctionalInterface
   public interface Validator<X> extends Serializable {
      /**
       * @return <code>null</code> if the value is valid, description of the mismatch otherwise.
       */
      String validate(Optional<X> actual, Session session);
   }
}
