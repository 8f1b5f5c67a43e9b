package com.sassextend.selector;

public class SelectorSyntaxException extends IllegalArgumentException {
    private final String source;
    private final int position;

    public SelectorSyntaxException(String message, String source, int position) {
        super(message + " at position " + position + " in \"" + source + "\"");
        this.source = source;
        this.position = position;
    }

    public String source() {
        return source;
    }

    public int position() {
        return position;
    }
}
