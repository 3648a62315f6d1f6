package io.kvchain.core.check;

public class CountCheckBuilder<R> extends CheckBuilder<R, Integer> {

   public CountCheckBuilder(String description, Extractor<R, Integer> extractor) {
      super(description, extractor);
   }

   public CheckBuilder<R, Integer> is(int expected) {
      return compare("is(" + expected + ")", expected, Predicate.EQUAL_TO);
   }

   public CheckBuilder<R, Integer> gt(int value) {
      return compare("gt(" + value + ")", value, Predicate.GREATER_THAN);
   }

   public CheckBuilder<R, Integer> gte(int value) {
      return compare("gte(" + value + ")", value, Predicate.GREATER_OR_EQUAL_TO);
   }

   public CheckBuilder<R, Integer> lt(int value) {
      return compare("lt(" + value + ")", value, Predicate.LESS_THAN);
   }

   public CheckBuilder<R, Integer> lte(int value) {
      return compare("lte(" + value + ")", value, Predicate.LESS_OR_EQUAL_TO);
   }

   public CheckBuilder<R, Integer> not(int value) {
      return compare("not(" + value + ")", value, Predicate.NOT_EQUAL_TO);
   }

   private CheckBuilder<R, Integer> compare(String name, int value, Predicate predicate) {
      return validate(name, (actual, session) -> {
         int count = actual.orElse(0);
         return predicate.test(count, value) ? null : "found " + count;
      });
   }

   enum Predicate {
      EQUAL_TO {
         @Override
         boolean test(int actual, int value) {
            return actual == value;
         }
      },
      NOT_EQUAL_TO {
         @Override
         boolean test(int actual, int value) {
            return actual != value;
         }
      },
      GREATER_THAN {
         @Override
         boolean test(int actual, int value) {
            return actual > value;
         }
      },
      GREATER_OR_EQUAL_TO {
         @Override
         boolean test(int actual, int value) {
            return actual >= value;
         }
      },
      LESS_THAN {
         @Override
         boolean test(int actual, int value) {
            return actual < value;
         }
      },
      LESS_OR_EQUAL_TO {
         @Override
         boolean test(int actual, int value) {
            return actual <= value;
         }
      };

      abstract boolean test(int actual, int value);
   }
}
