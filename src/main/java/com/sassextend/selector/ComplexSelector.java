package com.sassextend.selector;

import java.util.Objects;

/**
 * One link of a selector chain. The combinator relates this link's head to the previous link,
 * so {@code .a > .b} is the link {@code (DESCENDANT, .a)} followed by the link {@code (CHILD, .b)}.
 * A chain that starts with an explicit combinator ({@code > .a}) carries it on its first link.
 */
public final class ComplexSelector {
    private Combinator combinator;
    private CompoundSelector head;
    private ComplexSelector tail;

    public ComplexSelector(Combinator combinator, CompoundSelector head, ComplexSelector tail) {
        this.combinator = Objects.requireNonNull(combinator, "combinator");
        this.head = head;
        this.tail = tail;
    }

    public static ComplexSelector of(CompoundSelector head) {
        return new ComplexSelector(Combinator.DESCENDANT, head, null);
    }

    public Combinator combinator() {
        return combinator;
    }

    public void setCombinator(Combinator combinator) {
        this.combinator = Objects.requireNonNull(combinator, "combinator");
    }

    public CompoundSelector head() {
        return head;
    }

    public void setHead(CompoundSelector head) {
        this.head = head;
    }

    public ComplexSelector tail() {
        return tail;
    }

    public void setTail(ComplexSelector tail) {
        this.tail = tail;
    }

    public ComplexSelector last() {
        ComplexSelector current = this;
        while (current.tail != null) {
            current = current.tail;
        }
        return current;
    }

    /**
     * Appends {@code link} to the end of this chain and returns this chain's first link.
     */
    public ComplexSelector append(ComplexSelector link) {
        last().tail = link;
        return this;
    }

    public int length() {
        int length = 0;
        for (ComplexSelector current = this; current != null; current = current.tail) {
            length++;
        }
        return length;
    }

    /** Deep copy of the whole chain. */
    public ComplexSelector copy() {
        ComplexSelector copiedTail = tail != null ? tail.copy() : null;
        return new ComplexSelector(combinator, head != null ? head.copy() : null, copiedTail);
    }

    public String toCss() {
        StringBuilder sb = new StringBuilder();
        for (ComplexSelector current = this; current != null; current = current.tail) {
            if (current != this || current.combinator != Combinator.DESCENDANT) {
                if (current.combinator == Combinator.DESCENDANT) {
                    sb.append(' ');
                } else {
                    if (current != this) {
                        sb.append(' ');
                    }
                    sb.append(current.combinator.symbol()).append(' ');
                }
            }
            if (current.head != null) {
                sb.append(current.head.toCss());
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ComplexSelector other)) {
            return false;
        }
        ComplexSelector left = this;
        ComplexSelector right = other;
        while (left != null && right != null) {
            if (left.combinator != right.combinator || !Objects.equals(left.head, right.head)) {
                return false;
            }
            left = left.tail;
            right = right.tail;
        }
        return left == null && right == null;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (ComplexSelector current = this; current != null; current = current.tail) {
            hash = 31 * hash + current.combinator.hashCode();
            hash = 31 * hash + Objects.hashCode(current.head);
        }
        return hash;
    }

    @Override
    public String toString() {
        return toCss();
    }
}
