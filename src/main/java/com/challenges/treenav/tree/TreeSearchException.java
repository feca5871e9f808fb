package com.challenges.treenav.tree;

/**
 * Base type of every recoverable failure raised while building or searching a tree.
 */
public class TreeSearchException extends Exception {
    public TreeSearchException(String message) {
        super(message);
    }

    public TreeSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
