package com.challenges.treenav.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * An immutable tree of {@link TreeNode}s, materialized eagerly from a root element
 * and a {@link ChildrenProducer}.
 * <p>
 * Nodes are only ever attached below nodes already in the tree, so every non-root
 * node has exactly one parent and the structure is acyclic.
 *
 * @param <E> the raw element type
 */
public final class Tree<E> {
    private static final Logger LOG = LoggerFactory.getLogger(Tree.class);

    private final TreeNode<E> root;
    private final int size;

    private Tree(TreeNode<E> root, int size) {
        this.root = root;
        this.size = size;
    }

    /**
     * Builds a full tree, invoking the producer once per node in breadth-first order.
     *
     * @throws NilParameterException if the producer rejects an absent element
     * @throws BuildFailureException if the producer fails for any other reason; no
     *                               partial tree is returned
     */
    public static <E> Tree<E> build(E rootElement, ChildrenProducer<E> producer) throws TreeSearchException {
        Objects.requireNonNull(producer, "producer");

        TreeNode<E> root = new TreeNode<>(rootElement);
        Deque<TreeNode<E>> frontier = new ArrayDeque<>();
        frontier.add(root);
        int size = 1;

        while (!frontier.isEmpty()) {
            TreeNode<E> node = frontier.poll();
            List<? extends E> produced = produceChildren(producer, node);

            MutableList<TreeNode<E>> children = Lists.mutable.empty();
            for (E child : produced) {
                TreeNode<E> childNode = new TreeNode<>(child);
                children.add(childNode);
                frontier.add(childNode);
            }
            node.attach(children.toImmutable());
            size += children.size();
        }

        LOG.debug("Built tree of {} node(s) rooted at {}", size, rootElement);
        return new Tree<>(root, size);
    }

    private static <E> List<? extends E> produceChildren(ChildrenProducer<E> producer, TreeNode<E> node)
            throws TreeSearchException {
        List<? extends E> produced;
        try {
            produced = producer.childrenOf(node.element());
        } catch (NilParameterException e) {
            throw e;
        } catch (Exception e) {
            throw new BuildFailureException(e);
        }

        if (produced == null) {
            throw new BuildFailureException("Children producer returned null for " + node);
        }
        return produced;
    }

    public TreeNode<E> root() {
        return root;
    }

    public ImmutableList<TreeNode<E>> directChildren() {
        return root.children();
    }

    public int size() {
        return size;
    }

    /**
     * @return the number of edges on the longest root-to-leaf path
     */
    public int depth() {
        int depth = -1;
        MutableList<TreeNode<E>> level = Lists.mutable.with(root);
        while (level.notEmpty()) {
            depth++;
            MutableList<TreeNode<E>> next = Lists.mutable.empty();
            for (TreeNode<E> node : level) {
                next.addAllIterable(node.children());
            }
            level = next;
        }
        return depth;
    }

    /**
     * Walks the tree level by level, starting at the root.
     */
    public void breadthFirst(NodeVisitor<E> visitor) throws TreeSearchException {
        Objects.requireNonNull(visitor, "visitor");

        Deque<TreeNode<E>> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            TreeNode<E> node = queue.poll();
            Visit visit = visit(visitor, node);
            if (visit == Visit.HALT) {
                return;
            }
            if (visit == Visit.DESCEND) {
                for (TreeNode<E> child : node.children()) {
                    queue.add(child);
                }
            }
        }
    }

    /**
     * Walks the tree in pre-order, children left to right.
     */
    public void depthFirst(NodeVisitor<E> visitor) throws TreeSearchException {
        Objects.requireNonNull(visitor, "visitor");

        Deque<TreeNode<E>> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode<E> node = stack.pop();
            Visit visit = visit(visitor, node);
            if (visit == Visit.HALT) {
                return;
            }
            if (visit == Visit.DESCEND) {
                ImmutableList<TreeNode<E>> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
    }

    private static <E> Visit visit(NodeVisitor<E> visitor, TreeNode<E> node) throws TreeSearchException {
        Visit visit;
        try {
            visit = visitor.visit(node);
        } catch (NilParameterException | TraversalFailureException e) {
            throw e;
        } catch (TreeSearchException e) {
            throw new TraversalFailureException(e);
        }
        return Objects.requireNonNull(visit, "visitor returned no decision");
    }

    @Override
    public String toString() {
        return "Tree[root=" + root.element() + ", size=" + size + "]";
    }
}
