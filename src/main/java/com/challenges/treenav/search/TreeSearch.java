package com.challenges.treenav.search;

import com.challenges.treenav.tree.BuildFailureException;
import com.challenges.treenav.tree.ChildrenProducer;
import com.challenges.treenav.tree.NilParameterException;
import com.challenges.treenav.tree.TraversalFailureException;
import com.challenges.treenav.tree.Tree;
import com.challenges.treenav.tree.TreeNode;
import com.challenges.treenav.tree.TreeSearchException;
import com.challenges.treenav.tree.Visit;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural searches over trees built with a fixed {@link ChildrenProducer}.
 * <p>
 * Single-stage searches look at the descendants of a tree's root; the root itself is
 * the search context and is never reported as a match. Instances hold no mutable state.
 *
 * @param <E> the raw element type
 */
public final class TreeSearch<E> {
    private static final Logger LOG = LoggerFactory.getLogger(TreeSearch.class);

    private final ChildrenProducer<E> producer;

    public TreeSearch(ChildrenProducer<E> producer) {
        this.producer = Objects.requireNonNull(producer, "producer");
    }

    public Tree<E> buildTree(E rootElement) throws TreeSearchException {
        return Tree.build(rootElement, producer);
    }

    /**
     * Breadth-first search collecting the shallowest match on every branch.
     * <p>
     * The children of a matching node are never examined, so no result is an ancestor
     * of another. Results come in breadth-first order.
     *
     * @throws NilParameterException if a visited node holds no element
     */
    public ImmutableList<E> collectAndPrune(Tree<E> tree, SearchCriteria<? super E> criteria)
            throws TreeSearchException {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(criteria, "criteria");

        TreeNode<E> root = tree.root();
        MutableList<E> solution = Lists.mutable.empty();
        tree.breadthFirst(node -> {
            if (node == root) {
                return Visit.DESCEND;
            }
            E element = elementOf(node);
            if (!criteria.test(element)) {
                return Visit.DESCEND;
            }
            solution.add(element);
            return Visit.SKIP_SUBTREE;
        });
        return solution.toImmutable();
    }

    /**
     * Depth-first (pre-order) search that stops the whole walk at the first match.
     */
    public Optional<E> firstMatch(Tree<E> tree, SearchCriteria<? super E> criteria) throws TreeSearchException {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(criteria, "criteria");

        TreeNode<E> root = tree.root();
        MutableList<E> solution = Lists.mutable.empty();
        tree.depthFirst(node -> {
            if (node == root) {
                return Visit.DESCEND;
            }
            E element = elementOf(node);
            if (!criteria.test(element)) {
                return Visit.DESCEND;
            }
            solution.add(element);
            return Visit.HALT;
        });
        return Optional.ofNullable(solution.getFirst());
    }

    /**
     * Filters the root's immediate children without descending any further.
     * Children holding no element never match.
     */
    public ImmutableList<E> directChildrenMatching(Tree<E> tree, SearchCriteria<? super E> criteria) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(criteria, "criteria");

        return tree.directChildren()
                .select(child -> child.hasElement() && criteria.test(child.element()))
                .collect(TreeNode::element);
    }

    @SafeVarargs
    public final ImmutableList<E> extractNodes(E rootElement, SearchCriteria<? super E>... criteria)
            throws TreeSearchException {
        if (criteria == null) {
            return Lists.immutable.empty();
        }
        return extractNodes(rootElement, Arrays.asList(criteria));
    }

    /**
     * Narrows the document stage by stage: each criteria is applied with
     * {@link #collectAndPrune} to every subtree rooted at a match of the previous stage.
     * <p>
     * A {@code null} list, {@code null} entries and wildcard entries count as absent;
     * with nothing left the result is empty. A stage without matches ends the search with an empty result and later
     * criteria are never evaluated.
     *
     * @return the matches of the last stage, in working-set order
     * @throws BuildFailureException      if a subtree cannot be built, tagged with the
     *                                    stage and the element's ordinal
     * @throws TraversalFailureException if a stage's traversal fails, tagged with the stage
     */
    public ImmutableList<E> extractNodes(E rootElement, List<? extends SearchCriteria<? super E>> criteria)
            throws TreeSearchException {
        if (criteria == null) {
            return Lists.immutable.empty();
        }
        MutableList<SearchCriteria<? super E>> stages = Lists.mutable.empty();
        for (SearchCriteria<? super E> c : criteria) {
            if (c != null && !c.isWildcard()) {
                stages.add(c);
            }
        }
        if (stages.isEmpty()) {
            LOG.debug("No usable criteria among {} given, nothing to extract", criteria.size());
            return Lists.immutable.empty();
        }

        MutableList<Tree<E>> todo = Lists.mutable.with(buildTree(rootElement));

        for (int stage = 1; stage <= stages.size(); stage++) {
            SearchCriteria<? super E> c = stages.get(stage - 1);

            MutableList<E> matches = Lists.mutable.empty();
            for (Tree<E> tree : todo) {
                try {
                    matches.addAllIterable(collectAndPrune(tree, c));
                } catch (TreeSearchException e) {
                    throw TraversalFailureException.atStage(stage, e);
                }
            }

            if (matches.isEmpty()) {
                LOG.debug("Stage {}/{} matched nothing across {} tree(s)", stage, stages.size(), todo.size());
                return Lists.immutable.empty();
            }
            LOG.debug("Stage {}/{} matched {} element(s) across {} tree(s)",
                    stage, stages.size(), matches.size(), todo.size());

            MutableList<Tree<E>> next = Lists.mutable.empty();
            for (int i = 0; i < matches.size(); i++) {
                try {
                    next.add(buildTree(matches.get(i)));
                } catch (TreeSearchException e) {
                    throw BuildFailureException.atStage(stage, i + 1, e);
                }
            }
            todo = next;
        }

        return todo.collect(tree -> tree.root().element()).toImmutable();
    }

    private static <E> E elementOf(TreeNode<E> node) throws NilParameterException {
        if (node == null || !node.hasElement()) {
            throw new NilParameterException("node");
        }
        return node.element();
    }
}
