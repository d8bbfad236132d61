// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zip;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import sexpedit.tree.Node;
import sexpedit.tree.NodeKind;
import sexpedit.zipper.Location;
import sexpedit.zipper.Movement;
import sexpedit.zipper.Skip;

/**
 * Searches over syntax tree cursors.
 * <p>
 * A search tests the starting location first, then keeps applying a move, {@link Navigation#right(Location)} unless
 * told otherwise, until the predicate holds or the move fails.
 */
public final class Find {
    private Find() {
    }

    public static Optional<Location<Node>> find(
        final Location<Node> location,
        final Predicate<? super Location<Node>> predicate
    ) {
        return find(location, Navigation::right, predicate);
    }

    /**
     * Returns the first location satisfying {@code predicate}, starting at {@code location} and moving with
     * {@code move}.
     */
    public static Optional<Location<Node>> find(
        final Location<Node> location,
        final Movement<Node> move,
        final Predicate<? super Location<Node>> predicate
    ) {
        return Skip.skip(move, candidate -> !predicate.test(candidate), location);
    }

    public static Optional<Location<Node>> findByTag(final Location<Node> location, final NodeKind kind) {
        return findByTag(location, Navigation::right, kind);
    }

    /**
     * Returns the first location holding a node of the given kind.
     */
    public static Optional<Location<Node>> findByTag(
        final Location<Node> location,
        final Movement<Node> move,
        final NodeKind kind
    ) {
        return find(location, move, candidate -> Zip.tag(candidate) == kind);
    }

    /**
     * Returns the first location to the right of {@code location}, excluding it, holding a node of the given kind.
     */
    public static Optional<Location<Node>> findNextByTag(final Location<Node> location, final NodeKind kind) {
        return Navigation.right(location).flatMap(start -> findByTag(start, Navigation::right, kind));
    }

    /**
     * Returns the first location to the left of {@code location}, excluding it, holding a node of the given kind.
     */
    public static Optional<Location<Node>> findPreviousByTag(final Location<Node> location, final NodeKind kind) {
        return Navigation.left(location).flatMap(start -> findByTag(start, Navigation::left, kind));
    }

    public static Optional<Location<Node>> findToken(
        final Location<Node> location,
        final Predicate<Object> predicate
    ) {
        return findToken(location, Navigation::right, predicate);
    }

    /**
     * Returns the first token location whose literal value satisfies {@code predicate}.
     */
    public static Optional<Location<Node>> findToken(
        final Location<Node> location,
        final Movement<Node> move,
        final Predicate<Object> predicate
    ) {
        return find(location, move, candidate ->
            candidate.node() instanceof Node.Token token && predicate.test(token.value()));
    }

    public static Optional<Location<Node>> findValue(final Location<Node> location, final Object value) {
        return findValue(location, Navigation::right, value);
    }

    /**
     * Returns the first token location whose literal value equals {@code value}.
     */
    public static Optional<Location<Node>> findValue(
        final Location<Node> location,
        final Movement<Node> move,
        final Object value
    ) {
        return findToken(location, move, candidate -> Objects.equals(candidate, value));
    }
}
