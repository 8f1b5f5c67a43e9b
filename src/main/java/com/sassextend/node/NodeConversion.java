package com.sassextend.node;

import com.sassextend.context.Context;
import com.sassextend.selector.Combinator;
import com.sassextend.selector.ComplexSelector;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between selector chains and node collections.
 *
 * <p>Every link becomes a combinator node followed by a selector node, except that the descendant
 * combinator of the first link is left out. {@code .a .b > .c} converts to {@code [.a, ' ', .b, >, .c]}
 * and {@code > .a} to {@code [>, .a]}. A collection starting with a descendant combinator node has no chain
 * form, which keeps the two directions exact inverses.
 */
public final class NodeConversion {
    private static final Logger LOG = LoggerFactory.getLogger(NodeConversion.class);

    private NodeConversion() {
    }

    public static Node.CollectionNode chainToNode(ComplexSelector chain, Context ctx) {
        if (chain == null) {
            throw new NullSelectorException("Cannot convert a null selector chain");
        }
        Node.CollectionNode result = Node.createCollection();
        MutableList<Node> children = result.children();
        for (ComplexSelector link = chain; link != null; link = link.tail()) {
            if (link != chain || link.combinator() != Combinator.DESCENDANT) {
                children.add(Node.createCombinator(link.combinator()));
            }
            children.add(Node.createSelector(link, ctx));
        }
        LOG.debug("Converted chain '{}' to {}", chain, result);
        return result;
    }

    public static ComplexSelector nodeToChain(Node node, Context ctx) {
        if (!(node instanceof Node.CollectionNode collection)) {
            throw new MalformedChainException("Expected a collection of selectors and combinators but got "
                    + (node == null ? "null" : node.getClass().getSimpleName()), -1);
        }
        if (collection.isEmpty()) {
            throw new MalformedChainException("Cannot build a selector chain from an empty collection", -1);
        }

        ComplexSelector first = null;
        ComplexSelector last = null;
        Combinator pending = null;
        MutableList<Node> children = collection.children();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (child instanceof Node.CombinatorNode combinatorNode) {
                if (pending != null) {
                    throw rejected(collection, "Two combinators in a row", i);
                }
                if (first == null && combinatorNode.combinator() == Combinator.DESCENDANT) {
                    throw rejected(collection, "Chain cannot start with a descendant combinator", i);
                }
                pending = combinatorNode.combinator();
            } else if (child instanceof Node.SelectorNode selectorNode) {
                if (first != null && pending == null) {
                    throw rejected(collection, "Two selectors without a combinator between them", i);
                }
                ComplexSelector link = new ComplexSelector(
                        pending != null ? pending : Combinator.DESCENDANT,
                        ctx.copyOf(selectorNode.selector()),
                        null);
                if (first == null) {
                    first = link;
                } else {
                    last.setTail(link);
                }
                last = link;
                pending = null;
            } else {
                throw rejected(collection, "Unexpected " + (child.isNil() ? "nil" : "nested collection")
                        + " in a selector chain", i);
            }
        }

        if (pending != null) {
            throw rejected(collection, "Chain ends with a combinator", children.size() - 1);
        }
        return first;
    }

    private static MalformedChainException rejected(Node.CollectionNode collection, String reason, int index) {
        LOG.debug("Rejected {} as a selector chain: {} at element {}", collection, reason, index);
        return new MalformedChainException(reason, index);
    }
}
