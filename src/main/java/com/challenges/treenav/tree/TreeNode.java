package com.challenges.treenav.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Wraps one raw element of a {@link Tree}. The element may be {@code null}.
 * Children are attached once by the builder and never change afterwards.
 */
public final class TreeNode<E> {
    private final E element;
    private ImmutableList<TreeNode<E>> children = Lists.immutable.empty();
    private boolean attached;

    TreeNode(E element) {
        this.element = element;
    }

    public E element() {
        return element;
    }

    public boolean hasElement() {
        return element != null;
    }

    public ImmutableList<TreeNode<E>> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    void attach(ImmutableList<TreeNode<E>> produced) {
        if (attached) {
            throw new IllegalStateException("Children already attached to " + this);
        }
        this.children = produced;
        this.attached = true;
    }

    @Override
    public String toString() {
        return "TreeNode[" + element + "]";
    }
}
