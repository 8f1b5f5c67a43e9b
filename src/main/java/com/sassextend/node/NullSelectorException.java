package com.sassextend.node;

public final class NullSelectorException extends NodeException {
    public NullSelectorException(String message) {
        super(message);
    }
}
