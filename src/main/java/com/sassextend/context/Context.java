package com.sassextend.context;

import com.sassextend.selector.CompoundSelector;
import com.sassextend.selector.SimpleSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Owner of the compound selectors allocated during one compilation pass.
 * Node construction and cloning allocate through here so each pass can account for what it created.
 * Not thread safe; a pass runs on one thread.
 */
public class Context {
    private static final Logger LOG = LoggerFactory.getLogger(Context.class);

    private final String name;
    private long allocationCount;

    public Context() {
        this("default");
    }

    public Context(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /**
     * Allocates an independent copy of {@code source}.
     */
    public CompoundSelector copyOf(CompoundSelector source) {
        Objects.requireNonNull(source, "source");
        return record(source.copy());
    }

    public CompoundSelector newCompound(Iterable<SimpleSelector> simpleSelectors) {
        return record(CompoundSelector.of(simpleSelectors));
    }

    public long allocationCount() {
        return allocationCount;
    }

    private CompoundSelector record(CompoundSelector allocated) {
        allocationCount++;
        if (LOG.isTraceEnabled()) {
            LOG.trace("[{}] allocation #{}: {}", name, allocationCount, allocated.toCss());
        }
        return allocated;
    }

    @Override
    public String toString() {
        return "Context[" + name + ", allocations=" + allocationCount + "]";
    }
}
