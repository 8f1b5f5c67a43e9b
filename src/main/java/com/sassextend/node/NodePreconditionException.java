package com.sassextend.node;

/** A collection operation was applied to, or given, a node that is not a collection. */
public final class NodePreconditionException extends NodeException {
    public NodePreconditionException(String message) {
        super(message);
    }
}
