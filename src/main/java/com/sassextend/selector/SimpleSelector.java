package com.sassextend.selector;

import java.util.Objects;

/**
 * One simple selector inside a compound, e.g. {@code .btn}, {@code #main}, {@code :hover} or {@code [href]}.
 * The name never includes the kind's prefix or brackets.
 */
public record SimpleSelector(Kind kind, String name) {
    public enum Kind {
        TYPE("", ""),
        UNIVERSAL("", ""),
        CLASS(".", ""),
        ID("#", ""),
        PLACEHOLDER("%", ""),
        ATTRIBUTE("[", "]"),
        PSEUDO_CLASS(":", ""),
        PSEUDO_ELEMENT("::", ""),
        PARENT("", "");

        private final String prefix;
        private final String suffix;

        Kind(String prefix, String suffix) {
            this.prefix = prefix;
            this.suffix = suffix;
        }
    }

    public SimpleSelector {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    public static SimpleSelector type(String name) {
        return new SimpleSelector(Kind.TYPE, name);
    }

    public static SimpleSelector universal() {
        return new SimpleSelector(Kind.UNIVERSAL, "*");
    }

    public static SimpleSelector className(String name) {
        return new SimpleSelector(Kind.CLASS, name);
    }

    public static SimpleSelector id(String name) {
        return new SimpleSelector(Kind.ID, name);
    }

    public static SimpleSelector placeholder(String name) {
        return new SimpleSelector(Kind.PLACEHOLDER, name);
    }

    public static SimpleSelector attribute(String body) {
        return new SimpleSelector(Kind.ATTRIBUTE, body);
    }

    public static SimpleSelector pseudoClass(String name) {
        return new SimpleSelector(Kind.PSEUDO_CLASS, name);
    }

    public static SimpleSelector pseudoElement(String name) {
        return new SimpleSelector(Kind.PSEUDO_ELEMENT, name);
    }

    public static SimpleSelector parent() {
        return new SimpleSelector(Kind.PARENT, "&");
    }

    public String toCss() {
        return kind.prefix + name + kind.suffix;
    }

    @Override
    public String toString() {
        return toCss();
    }
}
