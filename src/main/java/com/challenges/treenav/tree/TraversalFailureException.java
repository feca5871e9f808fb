package com.challenges.treenav.tree;

/**
 * A visitor failed during a breadth-first or depth-first walk.
 */
public class TraversalFailureException extends TreeSearchException {
    private final int stage;

    public TraversalFailureException(Throwable cause) {
        this(0, "Traversal failed: " + cause.getMessage(), cause);
    }

    private TraversalFailureException(int stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public static TraversalFailureException atStage(int stage, Throwable cause) {
        return new TraversalFailureException(stage, "While applying criteria " + stage + ": " + cause.getMessage(), cause);
    }

    /**
     * @return the 1-based stage of a cascading search, or 0 when not tied to a stage
     */
    public int stage() {
        return stage;
    }
}
