package com.challenges.treenav.tree;

/**
 * What a walk does after a {@link NodeVisitor} has seen a node.
 */
public enum Visit {
    /** Continue, and expand the children of the current node. */
    DESCEND,

    /** Continue with the remaining nodes, but never expand the current node. */
    SKIP_SUBTREE,

    /** Stop the whole walk. */
    HALT
}
