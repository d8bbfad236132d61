// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.tree;

import sexpedit.util.collection.ConsList;

/**
 * A utility class containing factories and common queries on syntax tree nodes.
 */
public final class Nodes {
    private Nodes() {
    }

    /**
     * Returns a whitespace node holding a single space, the separator synthesized by insertions.
     */
    public static Node.Whitespace space() {
        return SPACE;
    }

    public static Node.Whitespace whitespace(final String text) {
        return new Node.Whitespace(text);
    }

    public static Node.Comment comment(final String text) {
        return new Node.Comment(text);
    }

    public static Node.Token token(final Object value) {
        return new Node.Token(value);
    }

    public static Node.Placeholder placeholder() {
        return Node.Placeholder.INSTANCE;
    }

    public static Node.List list(final Node... children) {
        return new Node.List(ConsList.of(children));
    }

    public static Node.Vector vector(final Node... children) {
        return new Node.Vector(ConsList.of(children));
    }

    public static Node.Set set(final Node... children) {
        return new Node.Set(ConsList.of(children));
    }

    public static Node.Map map(final Node... children) {
        return new Node.Map(ConsList.of(children));
    }

    /**
     * Returns a composite node of the given kind with the given children.
     *
     * @throws IllegalArgumentException if {@code kind} is not a composite kind
     */
    public static Node.Branching composite(final NodeKind kind, final ConsList<Node> children) {
        return switch (kind) {
            case LIST -> new Node.List(children);
            case VECTOR -> new Node.Vector(children);
            case SET -> new Node.Set(children);
            case MAP -> new Node.Map(children);
            default -> throw new IllegalArgumentException("Not a composite node kind: " + kind);
        };
    }

    /**
     * Returns the given children separated by single spaces, the layout insertions and conversions produce.
     */
    public static ConsList<Node> spaced(final Iterable<? extends Node> children) {
        var reversed = ConsList.<Node>empty();
        for (final var child : children) {
            if (!reversed.isEmpty()) {
                reversed = reversed.prepended(SPACE);
            }
            reversed = reversed.prepended(child);
        }
        return reversed.reversed();
    }

    /**
     * Returns the significant children of the given composite node, in source order.
     */
    public static ConsList<Node> significantChildren(final Node.Branching node) {
        return node.children().filter(Node::isSignificant);
    }

    private static final Node.Whitespace SPACE = new Node.Whitespace(" ");
}
