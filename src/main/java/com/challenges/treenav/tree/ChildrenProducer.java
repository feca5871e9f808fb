package com.challenges.treenav.tree;

import java.util.List;

/**
 * Yields the ordered children of a raw element.
 * <p>
 * Implementations must throw {@link NilParameterException} when handed a {@code null}
 * element instead of returning no children, so that an empty subtree and an invalid
 * input stay distinguishable. The builder performs no cycle detection: a producer that
 * yields an ancestor again never terminates.
 *
 * @param <E> the raw element type
 */
@FunctionalInterface
public interface ChildrenProducer<E> {
    List<? extends E> childrenOf(E element) throws Exception;
}
