// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zipper;

import sexpedit.util.collection.ConsList;

/**
 * Describes the shape of a tree to the zipper.
 * <p>
 * Implementations must be pure: the zipper calls them freely, any number of times, and relies on the results
 * depending on the arguments only.
 *
 * @param <N> the node type
 */
public interface TreeAdapter<N> {
    /**
     * Returns {@code true} iff the given node may have children. A branch node with no children is fine.
     */
    boolean isBranch(N node);

    /**
     * Returns the children of the given branch node, in order.
     * <p>
     * Only called on nodes for which {@link #isBranch(Object)} returned {@code true}.
     */
    ConsList<N> children(N node);

    /**
     * Returns a node like {@code node}, but with the given children.
     * <p>
     * Only called on nodes for which {@link #isBranch(Object)} returned {@code true}.
     */
    N makeNode(N node, ConsList<N> children);
}
