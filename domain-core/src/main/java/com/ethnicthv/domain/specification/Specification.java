package com.ethnicthv.domain.specification;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A composable business rule over candidates of type {@code T}.
 *
 * @param <T> the candidate type
 */
@FunctionalInterface
public interface Specification<T> {

    boolean isSatisfiedBy(T candidate);

    default Specification<T> and(Specification<T> other) {
        Objects.requireNonNull(other, "other");
        return candidate -> isSatisfiedBy(candidate) && other.isSatisfiedBy(candidate);
    }

    default Specification<T> or(Specification<T> other) {
        Objects.requireNonNull(other, "other");
        return candidate -> isSatisfiedBy(candidate) || other.isSatisfiedBy(candidate);
    }

    default Specification<T> not() {
        return candidate -> !isSatisfiedBy(candidate);
    }

    static <T> Specification<T> of(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return predicate::test;
    }
}
