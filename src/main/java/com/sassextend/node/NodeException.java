package com.sassextend.node;

/**
 * Internal error raised by the node algebra. These indicate a broken invariant in the caller,
 * never a problem with the user's stylesheet, so they abort the pass instead of being reported as syntax errors.
 */
public abstract sealed class NodeException extends RuntimeException
        permits NodePreconditionException, MalformedChainException, NullSelectorException {

    protected NodeException(String message) {
        super(message);
    }
}
