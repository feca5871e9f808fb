package com.challenges.treenav.tree;

/**
 * A required node or element was absent.
 */
public class NilParameterException extends TreeSearchException {
    private final String parameter;

    public NilParameterException(String parameter) {
        super("Parameter (" + parameter + ") cannot be null");
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }
}
