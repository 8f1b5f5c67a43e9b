package com.sassextend.node;

import org.eclipse.collections.api.list.MutableList;

public final class Nodes {
    private Nodes() {
    }

    /**
     * Structural equality with an optional relaxation for compound selectors. With
     * {@code simpleSelectorOrderDependent} set this is the same as {@link Object#equals}; without it,
     * selector nodes compare their simple selectors as sets. Collections recurse with the same flag.
     */
    public static boolean equal(Node one, Node two, boolean simpleSelectorOrderDependent) {
        if (one == two) {
            return true;
        }
        if (one == null || two == null || one.getClass() != two.getClass()) {
            return false;
        }

        if (one instanceof Node.SelectorNode left && two instanceof Node.SelectorNode right) {
            return simpleSelectorOrderDependent
                    ? left.selector().equals(right.selector())
                    : left.selector().equalsIgnoringOrder(right.selector());
        }
        if (one instanceof Node.CollectionNode left && two instanceof Node.CollectionNode right) {
            MutableList<Node> leftChildren = left.children();
            MutableList<Node> rightChildren = right.children();
            if (leftChildren.size() != rightChildren.size()) {
                return false;
            }
            for (int i = 0; i < leftChildren.size(); i++) {
                if (!equal(leftChildren.get(i), rightChildren.get(i), simpleSelectorOrderDependent)) {
                    return false;
                }
            }
            return true;
        }
        // combinators and nil carry no compound selector
        return one.equals(two);
    }

    static Node.CollectionNode requireCollection(Node node, String operation) {
        if (node instanceof Node.CollectionNode collection) {
            return collection;
        }
        throw new NodePreconditionException(operation + " requires a collection node but got "
                + (node == null ? "null" : node.getClass().getSimpleName() + " " + node));
    }
}
