// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zip;

import java.util.Optional;
import sexpedit.tree.Node;
import sexpedit.tree.NodeKind;
import sexpedit.zipper.Location;

/**
 * Entry point for cursors over syntax trees, and accessors for the node at a cursor.
 * <p>
 * Every accessor has an overload taking an {@link Optional} location, so that a chain of moves that may have run
 * off the tree can be inspected without unwrapping it first: an absent location has no tag, no value and is not
 * whitespace.
 */
public final class Zip {
    private Zip() {
    }

    /**
     * Returns a cursor positioned at the given root node.
     */
    public static Location<Node> of(final Node root) {
        return Location.of(NodeTreeAdapter.INSTANCE, root);
    }

    /**
     * Returns a cursor over nothing at all: a virtual insertion point that the first insertion replaces.
     */
    public static Location<Node> ofNothing() {
        return of(Node.Placeholder.INSTANCE);
    }

    /**
     * Returns the node at the given location.
     */
    public static Node node(final Location<Node> location) {
        return location.node();
    }

    public static Optional<Node> node(final Optional<Location<Node>> location) {
        return location.map(Location::node);
    }

    /**
     * Returns the kind tag of the node at the given location.
     */
    public static NodeKind tag(final Location<Node> location) {
        return location.node().kind();
    }

    public static Optional<NodeKind> tag(final Optional<Location<Node>> location) {
        return location.map(Zip::tag);
    }

    /**
     * Returns the value of the node at the given location: the literal of a token, or the raw text of whitespace or
     * a comment. Composite nodes and the placeholder have no value.
     */
    public static Optional<Object> value(final Location<Node> location) {
        final var node = location.node();
        if (node instanceof Node.Token token) {
            return Optional.of(token.value());
        } else if (node instanceof Node.Whitespace whitespace) {
            return Optional.of(whitespace.text());
        } else if (node instanceof Node.Comment comment) {
            return Optional.of(comment.text());
        } else {
            return Optional.empty();
        }
    }

    public static Optional<Object> value(final Optional<Location<Node>> location) {
        return location.flatMap(Zip::value);
    }

    /**
     * Returns {@code true} iff the node at the given location is whitespace or a comment.
     */
    public static boolean isWhitespace(final Location<Node> location) {
        return location.node().kind().isInsignificant();
    }

    public static boolean isWhitespace(final Optional<Location<Node>> location) {
        return location.isPresent() && isWhitespace(location.get());
    }
}
