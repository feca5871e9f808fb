package com.challenges.treenav.search;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A stateless test over a raw element: either the wildcard, which matches everything,
 * or a wrapped predicate.
 *
 * @param <E> the raw element type
 */
public sealed interface SearchCriteria<E> {

    record Wildcard<E>() implements SearchCriteria<E> {
        @Override
        public boolean test(E element) {
            return true;
        }
    }

    record Matching<E>(Predicate<? super E> predicate) implements SearchCriteria<E> {
        public Matching {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public boolean test(E element) {
            return predicate.test(element);
        }
    }

    boolean test(E element);

    default boolean isWildcard() {
        return this instanceof Wildcard;
    }

    static <E> SearchCriteria<E> wildcard() {
        return new Wildcard<>();
    }

    static <E> SearchCriteria<E> matching(Predicate<? super E> predicate) {
        return new Matching<>(predicate);
    }

    static <E> SearchCriteria<E> none() {
        return new Matching<>(element -> false);
    }

    default SearchCriteria<E> and(SearchCriteria<? super E> other) {
        Objects.requireNonNull(other, "other");
        if (other.isWildcard()) {
            return this;
        }
        if (isWildcard()) {
            return matching(other::test);
        }
        return matching(element -> test(element) && other.test(element));
    }

    default SearchCriteria<E> or(SearchCriteria<? super E> other) {
        Objects.requireNonNull(other, "other");
        if (isWildcard() || other.isWildcard()) {
            return wildcard();
        }
        return matching(element -> test(element) || other.test(element));
    }

    default SearchCriteria<E> negate() {
        if (isWildcard()) {
            return none();
        }
        return matching(element -> !test(element));
    }

    static <E> SearchCriteria<E> allOf(List<? extends SearchCriteria<? super E>> criteria) {
        SearchCriteria<E> combined = wildcard();
        for (SearchCriteria<? super E> c : criteria) {
            combined = combined.and(c);
        }
        return combined;
    }

    static <E> SearchCriteria<E> anyOf(List<? extends SearchCriteria<? super E>> criteria) {
        SearchCriteria<E> combined = none();
        for (SearchCriteria<? super E> c : criteria) {
            combined = combined.or(c);
        }
        return combined;
    }
}
