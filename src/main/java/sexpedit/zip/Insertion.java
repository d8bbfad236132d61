// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zip;

import java.util.Optional;
import sexpedit.tree.Node;
import sexpedit.tree.Nodes;
import sexpedit.zipper.Location;

/**
 * Insertions that keep the tree well-spaced.
 * <p>
 * An inserted node ends up separated from each significant neighbour by exactly one whitespace node. Whitespace or
 * a comment already adjacent to the insertion point is reused as a separator; a single space is synthesized only
 * where the new node would otherwise touch a significant neighbour.
 * <p>
 * Sibling insertions leave the cursor on the original node and fail at the root; child insertions leave it on the
 * parent and fail on nodes that cannot have children.
 */
public final class Insertion {
    private Insertion() {
    }

    /**
     * Inserts {@code item} to the right of the current node.
     * <p>
     * If the location is a virtual insertion point, {@code item} simply takes its place.
     */
    public static Optional<Location<Node>> insertRight(final Location<Node> location, final Node item) {
        if (!location.node().isReal()) {
            return Optional.of(location.replace(item));
        }
        final var neighbour = location.right();
        if (neighbour.isEmpty() || Zip.isWhitespace(neighbour.get())) {
            // node, SPACE, item, existing separator...
            return location.insertRight(item).flatMap(l -> l.insertRight(Nodes.space()));
        }
        return location.insertRight(Nodes.space())
            .flatMap(l -> l.insertRight(item))
            .flatMap(l -> l.insertRight(Nodes.space()));
    }

    /**
     * Inserts {@code item} to the left of the current node.
     * <p>
     * If the location is a virtual insertion point, {@code item} simply takes its place.
     */
    public static Optional<Location<Node>> insertLeft(final Location<Node> location, final Node item) {
        if (!location.node().isReal()) {
            return Optional.of(location.replace(item));
        }
        final var neighbour = location.left();
        if (neighbour.isEmpty() || Zip.isWhitespace(neighbour.get())) {
            return location.insertLeft(item).flatMap(l -> l.insertLeft(Nodes.space()));
        }
        return location.insertLeft(Nodes.space())
            .flatMap(l -> l.insertLeft(item))
            .flatMap(l -> l.insertLeft(Nodes.space()));
    }

    /**
     * Inserts {@code item} as the first child of the current node.
     */
    public static Optional<Location<Node>> insertChild(final Location<Node> location, final Node item) {
        final var first = location.down();
        if (needsNoSeparator(first)) {
            return location.insertChild(item);
        }
        return location.insertChild(Nodes.space()).flatMap(l -> l.insertChild(item));
    }

    /**
     * Inserts {@code item} as the last child of the current node.
     */
    public static Optional<Location<Node>> appendChild(final Location<Node> location, final Node item) {
        final var last = location.down().flatMap(Location::rightmost);
        if (needsNoSeparator(last)) {
            return location.appendChild(item);
        }
        return location.appendChild(Nodes.space()).flatMap(l -> l.appendChild(item));
    }

    private static boolean needsNoSeparator(final Optional<Location<Node>> neighbour) {
        return neighbour.isEmpty() || !neighbour.get().node().isReal() || Zip.isWhitespace(neighbour.get());
    }
}
