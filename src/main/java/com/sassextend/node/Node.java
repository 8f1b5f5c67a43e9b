package com.sassextend.node;

import com.sassextend.context.Context;
import com.sassextend.selector.Combinator;
import com.sassextend.selector.ComplexSelector;
import com.sassextend.selector.CompoundSelector;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Variant tree used while weaving selectors for {@code @extend}. A node is a compound selector,
 * a combinator, an ordered collection of nodes (nested to any depth) or nil. Nil is an explicit
 * absent value and is never equal to an empty collection.
 *
 * <p>Combinators are kept as separate nodes instead of being paired with the selector that follows them,
 * so a chain like {@code .a > .b} becomes {@code [.a, >, .b]}.
 */
public sealed interface Node {

    record SelectorNode(CompoundSelector selector) implements Node {
        public SelectorNode {
            Objects.requireNonNull(selector, "selector");
        }

        @Override
        public SelectorNode clone(Context ctx) {
            return new SelectorNode(ctx.copyOf(selector));
        }

        @Override
        public String toString() {
            return selector.toCss();
        }
    }

    record CombinatorNode(Combinator combinator) implements Node {
        public CombinatorNode {
            Objects.requireNonNull(combinator, "combinator");
        }

        @Override
        public CombinatorNode clone(Context ctx) {
            return this;
        }

        @Override
        public String toString() {
            return combinator == Combinator.DESCENDANT ? "' '" : combinator.symbol();
        }
    }

    record CollectionNode(MutableList<Node> children) implements Node {
        public CollectionNode {
            Objects.requireNonNull(children, "children");
            children = Lists.mutable.ofAll(children);
        }

        public int size() {
            return children.size();
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        public Node get(int index) {
            return children.get(index);
        }

        @Override
        public CollectionNode clone(Context ctx) {
            return new CollectionNode(children.collect(child -> child.clone(ctx)));
        }

        @Override
        public String toString() {
            return children.makeString("[", ", ", "]");
        }
    }

    record NilNode() implements Node {
        @Override
        public NilNode clone(Context ctx) {
            return new NilNode();
        }

        @Override
        public String toString() {
            return "nil";
        }
    }

    static CombinatorNode createCombinator(Combinator combinator) {
        return new CombinatorNode(combinator);
    }

    /**
     * Copies the head of {@code link} into a new selector node. The link's combinator and tail are not part
     * of the result; the combinator becomes its own node during conversion.
     */
    static SelectorNode createSelector(ComplexSelector link, Context ctx) {
        if (link == null) {
            throw new NullSelectorException("Cannot create a selector node from a null selector");
        }
        if (link.head() == null) {
            throw new NullSelectorException("Cannot create a selector node from a link without a compound selector: " + link);
        }
        return new SelectorNode(ctx.copyOf(link.head()));
    }

    /**
     * Wraps a compound selector that was already allocated through a context. The node takes ownership of it.
     */
    static SelectorNode createSelector(CompoundSelector allocated) {
        if (allocated == null) {
            throw new NullSelectorException("Cannot create a selector node from a null compound selector");
        }
        return new SelectorNode(allocated);
    }

    static CollectionNode createCollection() {
        return new CollectionNode(Lists.mutable.empty());
    }

    static CollectionNode createCollection(Iterable<? extends Node> values) {
        MutableList<Node> children = Lists.mutable.empty();
        int index = 0;
        for (Node value : values) {
            if (value == null) {
                throw new NodePreconditionException("Collection element " + index + " is null; use a nil node for absent values");
            }
            children.add(value);
            index++;
        }
        return new CollectionNode(children);
    }

    static CollectionNode createCollection(Node... values) {
        return createCollection(Lists.mutable.of(values));
    }

    static NilNode createNil() {
        return new NilNode();
    }

    /**
     * Deep copy. Selector payloads are reallocated through {@code ctx}, so the copy shares no mutable state
     * with this node.
     */
    Node clone(Context ctx);

    default boolean isSelector() {
        return this instanceof SelectorNode;
    }

    default boolean isCombinator() {
        return this instanceof CombinatorNode;
    }

    default boolean isCollection() {
        return this instanceof CollectionNode;
    }

    default boolean isNil() {
        return this instanceof NilNode;
    }

    /**
     * Appends a copy of each element of {@code rhs} to this collection, in order. Both nodes must be collections.
     * Nothing is flattened or deduplicated, and {@code rhs} itself is left unchanged. The copies are cloned
     * through {@code ctx}, so the two collections share no nodes afterwards.
     */
    default void plus(Node rhs, Context ctx) {
        CollectionNode target = Nodes.requireCollection(this, "plus");
        CollectionNode source = Nodes.requireCollection(rhs, "plus");
        // cloned up front so a.plus(a) terminates
        MutableList<Node> appended = source.children().collect(child -> child.clone(ctx));
        target.children().addAll(appended);
    }

    /**
     * Whether one of this collection's sequences matches {@code potentialChild}. When
     * {@code simpleSelectorOrderDependent} is false, compound selectors match regardless of the order
     * of their simple selectors; combinators and sequence order always matter. An empty sequence never matches.
     */
    default boolean contains(Node potentialChild, boolean simpleSelectorOrderDependent) {
        CollectionNode candidates = Nodes.requireCollection(this, "contains");
        CollectionNode sought = Nodes.requireCollection(potentialChild, "contains");
        if (sought.isEmpty()) {
            return false;
        }
        return candidates.children().anySatisfy(candidate -> Nodes.equal(candidate, sought, simpleSelectorOrderDependent));
    }
}
