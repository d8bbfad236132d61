// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zipper;

import sexpedit.util.collection.ConsList;

/**
 * The breadcrumb trail from a cursor to the root, holding everything needed to put the tree back together.
 *
 * @param <N> the node type
 */
public sealed interface Path<N> {
    /**
     * Returns the path of a cursor positioned at the root.
     */
    @SuppressWarnings("unchecked")
    static <N> Path<N> root() {
        return (Path<N>) Root.INSTANCE;
    }

    /**
     * Returns {@code true} iff the cursor this path belongs to is at the root.
     */
    default boolean isRoot() {
        return this instanceof Root<?>;
    }

    /**
     * Returns this path with the changed flag set, so that moving up rebuilds the parent. Root paths have nothing to
     * rebuild and are returned as is.
     */
    Path<N> markedChanged();

    /**
     * The path of the root: there are no ancestors.
     */
    @SuppressWarnings("rawtypes")
    final class Root<N> implements Path<N> {
        private Root() {
        }

        @Override
        public Path<N> markedChanged() {
            return this;
        }

        @Override
        public String toString() {
            return "Root";
        }

        private static final Root INSTANCE = new Root();
    }

    /**
     * A step down from a parent to one of its children.
     *
     * @param lefts      The siblings to the left of the current node, nearest first.
     * @param rights     The siblings to the right of the current node, in order.
     * @param parent     The parent node as it was when the cursor descended into it.
     * @param parentPath The path of the parent.
     * @param changed    {@code true} iff anything below the parent was edited, so it has to be rebuilt on the way up.
     */
    record Frame<N>(ConsList<N> lefts, ConsList<N> rights, N parent, Path<N> parentPath, boolean changed)
        implements Path<N> {
        @Override
        public Frame<N> markedChanged() {
            return changed ? this : new Frame<>(lefts, rights, parent, parentPath, true);
        }

        Frame<N> withSiblings(final ConsList<N> newLefts, final ConsList<N> newRights) {
            return new Frame<>(newLefts, newRights, parent, parentPath, changed);
        }

        Frame<N> withEditedSiblings(final ConsList<N> newLefts, final ConsList<N> newRights) {
            return new Frame<>(newLefts, newRights, parent, parentPath, true);
        }

        /**
         * Returns the full child list of the parent with the given node in the position of the cursor.
         */
        ConsList<N> childrenAround(final N node) {
            return lefts.reversedOnto(rights.prepended(node));
        }
    }
}
