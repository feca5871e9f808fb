package com.challenges.treenav.tree;

/**
 * The children producer failed while a tree was being built.
 * <p>
 * When raised by a cascading search the exception also records the 1-based
 * stage and the 1-based ordinal of the element whose subtree could not be built.
 * Both are 0 when the failure is not tied to a stage.
 */
public class BuildFailureException extends TreeSearchException {
    private final int stage;
    private final int ordinal;

    public BuildFailureException(String message) {
        super(message);
        this.stage = 0;
        this.ordinal = 0;
    }

    public BuildFailureException(Throwable cause) {
        this(0, 0, "Failed to build tree: " + cause.getMessage(), cause);
    }

    private BuildFailureException(int stage, int ordinal, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.ordinal = ordinal;
    }

    public static BuildFailureException atStage(int stage, int ordinal, Throwable cause) {
        String message = "While adding tree " + ordinal + " at stage " + stage + ": " + cause.getMessage();
        return new BuildFailureException(stage, ordinal, message, cause);
    }

    public int stage() {
        return stage;
    }

    public int ordinal() {
        return ordinal;
    }
}
