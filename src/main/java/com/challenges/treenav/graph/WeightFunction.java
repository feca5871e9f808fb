package com.challenges.treenav.graph;

import java.util.OptionalDouble;

/**
 * Weight of the edge from one vertex to another, empty when there is no such edge.
 */
@FunctionalInterface
public interface WeightFunction<V> {
    OptionalDouble weight(V from, V to);
}
