package com.challenges.treenav.graph;

import com.challenges.treenav.tree.ChildrenProducer;
import com.challenges.treenav.tree.NilParameterException;
import com.challenges.treenav.tree.Tree;
import com.challenges.treenav.tree.TreeSearchException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A directed graph stored as a dense adjacency matrix of optional weights.
 * Vertices are compared with {@link Object#equals}.
 */
public final class WeightedGraph<V> {
    private final ImmutableList<V> vertices;
    // null marks a missing edge
    private final Double[][] edges;

    public WeightedGraph(List<? extends V> vertices, WeightFunction<? super V> weights) {
        Objects.requireNonNull(weights, "weights");
        this.vertices = Lists.immutable.withAll(vertices);

        int n = this.vertices.size();
        this.edges = new Double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                OptionalDouble w = weights.weight(this.vertices.get(i), this.vertices.get(j));
                edges[i][j] = w.isPresent() ? w.getAsDouble() : null;
            }
        }
    }

    /**
     * @return the position of the vertex, or -1 if it is not part of the graph
     */
    public int indexOf(V vertex) {
        return vertices.indexOf(vertex);
    }

    /**
     * @return the targets of the edges leaving {@code from}, in vertex order; empty for an unknown vertex
     */
    public ImmutableList<V> adjacentOf(V from) {
        int index = indexOf(from);
        if (index == -1) {
            return Lists.immutable.empty();
        }

        MutableList<V> adjacent = Lists.mutable.empty();
        for (int j = 0; j < vertices.size(); j++) {
            if (edges[index][j] != null) {
                adjacent.add(vertices.get(j));
            }
        }
        return adjacent.toImmutable();
    }

    public OptionalDouble edge(V from, V to) {
        int i = indexOf(from);
        int j = indexOf(to);
        if (i == -1 || j == -1 || edges[i][j] == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(edges[i][j]);
    }

    public ImmutableList<V> vertices() {
        return vertices;
    }

    /**
     * Produces children by following outgoing edges. Only terminates on acyclic graphs.
     */
    public ChildrenProducer<V> successors() {
        return vertex -> {
            if (vertex == null) {
                throw new NilParameterException("element");
            }
            return adjacentOf(vertex).castToList();
        };
    }

    public Tree<V> makeTree(V root, ChildrenProducer<V> producer) throws TreeSearchException {
        return Tree.build(root, producer);
    }

    public Tree<V> makeTree(V root) throws TreeSearchException {
        return makeTree(root, successors());
    }
}
