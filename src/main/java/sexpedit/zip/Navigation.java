// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zip;

import java.util.Optional;
import sexpedit.tree.Node;
import sexpedit.zipper.Location;
import sexpedit.zipper.Movement;
import sexpedit.zipper.Skip;

/**
 * Cursor moves that never stop on whitespace or comments.
 * <p>
 * Each move is the corresponding primitive {@link Location} move, followed by skipping insignificant locations in
 * a fixed direction. A move fails when no significant location exists in the requested direction.
 */
public final class Navigation {
    private Navigation() {
    }

    /**
     * Moves to the next significant sibling.
     */
    public static Optional<Location<Node>> right(final Location<Node> location) {
        return skipWhitespace(Location::right, location.right());
    }

    /**
     * Moves to the previous significant sibling.
     */
    public static Optional<Location<Node>> left(final Location<Node> location) {
        return skipWhitespace(Location::left, location.left());
    }

    /**
     * Moves to the first significant child.
     */
    public static Optional<Location<Node>> down(final Location<Node> location) {
        return skipWhitespace(Location::right, location.down());
    }

    /**
     * Moves to the parent.
     * <p>
     * Parents are always composite, so the leftward skip that follows the move never actually moves in a well-formed
     * tree.
     */
    public static Optional<Location<Node>> up(final Location<Node> location) {
        return skipWhitespace(Location::left, location.up());
    }

    /**
     * Moves to the next significant location in depth-first pre-order.
     */
    public static Optional<Location<Node>> next(final Location<Node> location) {
        return skipWhitespace(Location::next, location.next());
    }

    /**
     * Moves to the previous significant location in depth-first pre-order.
     */
    public static Optional<Location<Node>> prev(final Location<Node> location) {
        return skipWhitespace(Location::prev, location.prev());
    }

    /**
     * Moves to the first significant sibling.
     */
    public static Optional<Location<Node>> leftmost(final Location<Node> location) {
        return skipWhitespace(Location::right, location.leftmost());
    }

    /**
     * Moves to the last significant sibling.
     */
    public static Optional<Location<Node>> rightmost(final Location<Node> location) {
        return skipWhitespace(Location::left, location.rightmost());
    }

    /**
     * Moves right until a significant location is reached, staying put if already at one.
     */
    public static Optional<Location<Node>> skipWhitespace(final Location<Node> location) {
        return skipWhitespace(Location::right, location);
    }

    /**
     * Applies the given move until a significant location is reached, staying put if already at one.
     */
    public static Optional<Location<Node>> skipWhitespace(final Movement<Node> move, final Location<Node> location) {
        return Skip.skip(move, Zip::isWhitespace, location);
    }

    /**
     * Moves left until a significant location is reached, staying put if already at one.
     */
    public static Optional<Location<Node>> skipWhitespaceLeft(final Location<Node> location) {
        return skipWhitespace(Location::left, location);
    }

    /**
     * Removes the node at the given location; see {@link Location#remove()}.
     */
    public static Optional<Location<Node>> remove(final Location<Node> location) {
        return location.remove();
    }

    private static Optional<Location<Node>> skipWhitespace(
        final Movement<Node> move,
        final Optional<Location<Node>> location
    ) {
        return Skip.skip(move, Zip::isWhitespace, location);
    }
}
