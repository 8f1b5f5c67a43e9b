package com.sassextend.selector;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * A conjunction of simple selectors with no combinator, e.g. {@code a.btn:hover}.
 * Instances are mutable; use {@link #copy()} to get an independent value.
 */
public final class CompoundSelector {
    private final MutableList<SimpleSelector> simpleSelectors;

    private CompoundSelector(MutableList<SimpleSelector> simpleSelectors) {
        this.simpleSelectors = simpleSelectors;
    }

    public static CompoundSelector empty() {
        return new CompoundSelector(Lists.mutable.empty());
    }

    public static CompoundSelector of(SimpleSelector... simpleSelectors) {
        return new CompoundSelector(Lists.mutable.of(simpleSelectors));
    }

    public static CompoundSelector of(Iterable<SimpleSelector> simpleSelectors) {
        return new CompoundSelector(Lists.mutable.ofAll(simpleSelectors));
    }

    public CompoundSelector add(SimpleSelector simpleSelector) {
        simpleSelectors.add(Objects.requireNonNull(simpleSelector, "simpleSelector"));
        return this;
    }

    public boolean remove(SimpleSelector simpleSelector) {
        return simpleSelectors.remove(simpleSelector);
    }

    public MutableList<SimpleSelector> simpleSelectors() {
        return simpleSelectors.asUnmodifiable();
    }

    public int size() {
        return simpleSelectors.size();
    }

    public boolean isEmpty() {
        return simpleSelectors.isEmpty();
    }

    public CompoundSelector copy() {
        return new CompoundSelector(Lists.mutable.ofAll(simpleSelectors));
    }

    /**
     * Compares the two compounds as sets of simple selectors, so {@code .a.b} matches {@code .b.a}.
     */
    public boolean equalsIgnoringOrder(CompoundSelector other) {
        if (other == null) {
            return false;
        }
        return simpleSelectors.toSet().equals(other.simpleSelectors.toSet());
    }

    public String toCss() {
        return simpleSelectors.collect(SimpleSelector::toCss).makeString("");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CompoundSelector other && simpleSelectors.equals(other.simpleSelectors);
    }

    @Override
    public int hashCode() {
        return simpleSelectors.hashCode();
    }

    @Override
    public String toString() {
        return toCss();
    }
}
