package com.sassextend.node;

/** A node tree that doesn't describe a flat, alternating selector chain. */
public final class MalformedChainException extends NodeException {
    private final int index;

    public MalformedChainException(String message, int index) {
        super(index >= 0 ? message + " (element " + index + ")" : message);
        this.index = index;
    }

    /** Index of the offending element, or -1 when the problem is the tree as a whole. */
    public int index() {
        return index;
    }
}
