// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.tree;

import java.util.Objects;
import sexpedit.util.collection.ConsList;

/**
 * A node of the format-preserving syntax tree.
 * <p>
 * Nodes are immutable. Composite nodes implement {@link Branching} and own an ordered child list that keeps
 * whitespace and comments interleaved with the significant children, in source order.
 */
public sealed interface Node {
    /**
     * Retrieves the kind tag of this node.
     */
    NodeKind kind();

    /**
     * Returns {@code true} iff this node is an actual part of the tree, that is, anything but {@link Placeholder}.
     */
    default boolean isReal() {
        return true;
    }

    /**
     * Returns {@code true} iff this node is significant, that is, neither whitespace nor a comment.
     */
    default boolean isSignificant() {
        return !kind().isInsignificant();
    }

    /**
     * Capability interface of composite nodes: the only nodes that have children.
     */
    sealed interface Branching extends Node {
        /**
         * Retrieves the children of this node, in source order.
         */
        ConsList<Node> children();

        /**
         * Returns a node of the same kind as this one, with the given children.
         */
        Branching withChildren(ConsList<Node> children);
    }

    /**
     * A parenthesized list, {@code (a b c)}.
     */
    record List(ConsList<Node> children) implements Branching {
        public List {
            Objects.requireNonNull(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LIST;
        }

        @Override
        public List withChildren(final ConsList<Node> children) {
            return new List(children);
        }
    }

    /**
     * A vector, {@code [a b c]}.
     */
    record Vector(ConsList<Node> children) implements Branching {
        public Vector {
            Objects.requireNonNull(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.VECTOR;
        }

        @Override
        public Vector withChildren(final ConsList<Node> children) {
            return new Vector(children);
        }
    }

    /**
     * A set literal, {@code #{a b c}}.
     */
    record Set(ConsList<Node> children) implements Branching {
        public Set {
            Objects.requireNonNull(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SET;
        }

        @Override
        public Set withChildren(final ConsList<Node> children) {
            return new Set(children);
        }
    }

    /**
     * A map literal, {@code {k1 v1 k2 v2}}. Keys and values are plain alternating children.
     */
    record Map(ConsList<Node> children) implements Branching {
        public Map {
            Objects.requireNonNull(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MAP;
        }

        @Override
        public Map withChildren(final ConsList<Node> children) {
            return new Map(children);
        }
    }

    /**
     * An atomic form carrying a single literal value: a number, string, character or symbol.
     */
    record Token(Object value) implements Node {
        public Token {
            Objects.requireNonNull(value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TOKEN;
        }
    }

    /**
     * A run of whitespace, kept verbatim.
     */
    record Whitespace(String text) implements Node {
        public Whitespace {
            Objects.requireNonNull(text);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.WHITESPACE;
        }
    }

    /**
     * A comment, kept verbatim including its leading semicolon and trailing line feed, if any.
     */
    record Comment(String text) implements Node {
        public Comment {
            Objects.requireNonNull(text);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMMENT;
        }
    }

    /**
     * The empty marker: a location holding it is a virtual insertion point, not a missing location.
     */
    enum Placeholder implements Node {
        INSTANCE;

        @Override
        public NodeKind kind() {
            return NodeKind.PLACEHOLDER;
        }

        @Override
        public boolean isReal() {
            return false;
        }
    }
}
