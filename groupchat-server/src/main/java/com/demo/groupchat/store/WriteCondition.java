package com.demo.groupchat.store;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Predicate over the currently stored document (null when absent), evaluated by the
 * backend atomically with the write it guards.
 */
@FunctionalInterface
public interface WriteCondition<T> {

    boolean test(T current);

    static <T> WriteCondition<T> none() {
        return current -> true;
    }

    static <T> WriteCondition<T> notExists() {
        return Objects::isNull;
    }

    static <T> WriteCondition<T> exists() {
        return Objects::nonNull;
    }

    static <T> WriteCondition<T> matches(Predicate<T> predicate) {
        return current -> current != null && predicate.test(current);
    }
}
