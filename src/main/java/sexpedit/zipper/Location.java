// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zipper;

import java.util.Optional;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import sexpedit.util.InvariantViolationError;
import sexpedit.util.collection.ConsList;

/**
 * A cursor into an immutable tree: the current node, plus the {@link Path} back to the root.
 * <p>
 * Locations are values. Every move and every edit returns a new location and leaves the receiver usable, so a
 * caller can try an edit, look at the result and throw it away, or backtrack to any earlier location. Edits only
 * allocate along the path from the edited node to the root; every untouched subtree is shared between the old and
 * the new tree. Ancestors of an edited node are rebuilt lazily, as the cursor moves up through them.
 * <p>
 * Operations that cannot be performed, such as moving past the last sibling, return an empty optional.
 *
 * @param <N>     the node type
 * @param adapter The description of the tree's shape.
 * @param node    The node the cursor is positioned at.
 * @param path    The way back up to the root.
 */
public record Location<N>(TreeAdapter<N> adapter, N node, Path<N> path) {
    /**
     * Returns a cursor positioned at the given root node.
     */
    public static <N> Location<N> of(final TreeAdapter<N> adapter, final N root) {
        return new Location<>(adapter, root, Path.root());
    }

    /**
     * Returns {@code true} iff this cursor is positioned at the root.
     */
    public boolean isRoot() {
        return path.isRoot();
    }

    /**
     * Returns the siblings to the left of the current node, nearest first. Empty at the root.
     */
    public ConsList<N> lefts() {
        return (path instanceof Path.Frame<N> frame) ? frame.lefts() : ConsList.empty();
    }

    /**
     * Returns the siblings to the right of the current node, in order. Empty at the root.
     */
    public ConsList<N> rights() {
        return (path instanceof Path.Frame<N> frame) ? frame.rights() : ConsList.empty();
    }

    /**
     * Moves to the first child. Fails if the current node is not a branch or has no children.
     */
    @CheckReturnValue
    public Optional<Location<N>> down() {
        if (!adapter.isBranch(node)) {
            return Optional.empty();
        }
        final var children = adapter.children(node);
        if (children.isEmpty()) {
            return Optional.empty();
        }
        final var frame = new Path.Frame<>(ConsList.empty(), children.withoutFirst(), node, path, false);
        return Optional.of(new Location<>(adapter, children.first(), frame));
    }

    /**
     * Moves to the parent, rebuilding it first if anything below it was edited. Fails at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> up() {
        if (!(path instanceof Path.Frame<N> frame)) {
            return Optional.empty();
        }
        if (!frame.changed()) {
            return Optional.of(new Location<>(adapter, frame.parent(), frame.parentPath()));
        }
        final var rebuilt = adapter.makeNode(frame.parent(), frame.childrenAround(node));
        return Optional.of(new Location<>(adapter, rebuilt, frame.parentPath().markedChanged()));
    }

    /**
     * Moves to the next sibling. Fails at the last sibling and at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> right() {
        if (!(path instanceof Path.Frame<N> frame) || frame.rights().isEmpty()) {
            return Optional.empty();
        }
        final var rights = frame.rights();
        final var moved = frame.withSiblings(frame.lefts().prepended(node), rights.withoutFirst());
        return Optional.of(new Location<>(adapter, rights.first(), moved));
    }

    /**
     * Moves to the previous sibling. Fails at the first sibling and at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> left() {
        if (!(path instanceof Path.Frame<N> frame) || frame.lefts().isEmpty()) {
            return Optional.empty();
        }
        final var lefts = frame.lefts();
        final var moved = frame.withSiblings(lefts.withoutFirst(), frame.rights().prepended(node));
        return Optional.of(new Location<>(adapter, lefts.first(), moved));
    }

    /**
     * Moves to the first sibling, staying put if already there. Fails only at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> leftmost() {
        if (!(path instanceof Path.Frame<N> frame)) {
            return Optional.empty();
        }
        if (frame.lefts().isEmpty()) {
            return Optional.of(this);
        }
        var current = node;
        var lefts = frame.lefts();
        var rights = frame.rights();
        while (!lefts.isEmpty()) {
            rights = rights.prepended(current);
            current = lefts.first();
            lefts = lefts.withoutFirst();
        }
        return Optional.of(new Location<>(adapter, current, frame.withSiblings(lefts, rights)));
    }

    /**
     * Moves to the last sibling, staying put if already there. Fails only at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> rightmost() {
        if (!(path instanceof Path.Frame<N> frame)) {
            return Optional.empty();
        }
        if (frame.rights().isEmpty()) {
            return Optional.of(this);
        }
        var current = node;
        var lefts = frame.lefts();
        var rights = frame.rights();
        while (!rights.isEmpty()) {
            lefts = lefts.prepended(current);
            current = rights.first();
            rights = rights.withoutFirst();
        }
        return Optional.of(new Location<>(adapter, current, frame.withSiblings(lefts, rights)));
    }

    /**
     * Moves to the next location in depth-first pre-order: the first child if there is one, otherwise the next
     * sibling of the nearest ancestor-or-self that has one. Fails at the last location of the tree.
     */
    @CheckReturnValue
    public Optional<Location<N>> next() {
        final var child = down();
        if (child.isPresent()) {
            return child;
        }
        var current = this;
        while (true) {
            final var sibling = current.right();
            if (sibling.isPresent()) {
                return sibling;
            }
            final var parent = current.up();
            if (parent.isEmpty()) {
                return Optional.empty();
            }
            current = parent.get();
        }
    }

    /**
     * Moves to the previous location in depth-first pre-order, the exact inverse of {@link #next()}: the deepest
     * last descendant of the previous sibling, or the parent if there is no previous sibling. Fails at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> prev() {
        final var sibling = left();
        if (sibling.isEmpty()) {
            return up();
        }
        var current = sibling.get();
        while (true) {
            final var child = current.down();
            if (child.isEmpty()) {
                return Optional.of(current);
            }
            current = child.get().lastSibling();
        }
    }

    /**
     * Inserts the given node as the left sibling of the current node, without moving. Fails at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> insertLeft(final N item) {
        if (!(path instanceof Path.Frame<N> frame)) {
            return Optional.empty();
        }
        final var edited = frame.withEditedSiblings(frame.lefts().prepended(item), frame.rights());
        return Optional.of(new Location<>(adapter, node, edited));
    }

    /**
     * Inserts the given node as the right sibling of the current node, without moving. Fails at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> insertRight(final N item) {
        if (!(path instanceof Path.Frame<N> frame)) {
            return Optional.empty();
        }
        final var edited = frame.withEditedSiblings(frame.lefts(), frame.rights().prepended(item));
        return Optional.of(new Location<>(adapter, node, edited));
    }

    /**
     * Inserts the given node as the first child of the current node, without moving. Fails if the current node is
     * not a branch.
     */
    @CheckReturnValue
    public Optional<Location<N>> insertChild(final N item) {
        if (!adapter.isBranch(node)) {
            return Optional.empty();
        }
        return Optional.of(replace(adapter.makeNode(node, adapter.children(node).prepended(item))));
    }

    /**
     * Inserts the given node as the last child of the current node, without moving. Fails if the current node is
     * not a branch.
     */
    @CheckReturnValue
    public Optional<Location<N>> appendChild(final N item) {
        if (!adapter.isBranch(node)) {
            return Optional.empty();
        }
        return Optional.of(replace(adapter.makeNode(node, adapter.children(node).appended(item))));
    }

    /**
     * Replaces the current node with the given one, without moving.
     */
    @CheckReturnValue
    public Location<N> replace(final N replacement) {
        return new Location<>(adapter, replacement, path.markedChanged());
    }

    /**
     * Removes the current node. The cursor moves to the previous sibling if there is one, or to the parent
     * otherwise. Fails at the root.
     */
    @CheckReturnValue
    public Optional<Location<N>> remove() {
        if (!(path instanceof Path.Frame<N> frame)) {
            return Optional.empty();
        }
        final var lefts = frame.lefts();
        if (!lefts.isEmpty()) {
            final var edited = frame.withEditedSiblings(lefts.withoutFirst(), frame.rights());
            return Optional.of(new Location<>(adapter, lefts.first(), edited));
        }
        final var parent = adapter.makeNode(frame.parent(), frame.rights());
        return Optional.of(new Location<>(adapter, parent, frame.parentPath().markedChanged()));
    }

    /**
     * Moves all the way up and returns the root node, with every edit made along the way applied.
     */
    public N root() {
        var current = this;
        while (true) {
            final var parent = current.up();
            if (parent.isEmpty()) {
                return current.node;
            }
            current = parent.get();
        }
    }

    @Override
    public String toString() {
        return "Location[node=" + node + ", path=" + path + "]";
    }

    private Location<N> lastSibling() {
        return rightmost().orElseThrow(() -> new InvariantViolationError("A child location has no path"));
    }
}
