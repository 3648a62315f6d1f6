package io.kvchain.function;

import java.io.Serializable;
import java.util.function.BiPredicate;

public interface SerializableBiPredicate<T, U> extends Serializable, BiPredicate<T, U> {
}
