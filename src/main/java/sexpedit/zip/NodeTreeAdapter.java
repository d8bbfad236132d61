// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zip;

import sexpedit.tree.Node;
import sexpedit.util.InvariantViolationError;
import sexpedit.util.collection.ConsList;
import sexpedit.zipper.TreeAdapter;

/**
 * Shape of the syntax tree as seen by the zipper: exactly the {@link Node.Branching} nodes are branches.
 */
public enum NodeTreeAdapter implements TreeAdapter<Node> {
    INSTANCE;

    @Override
    public boolean isBranch(final Node node) {
        return node instanceof Node.Branching;
    }

    @Override
    public ConsList<Node> children(final Node node) {
        return asBranching(node).children();
    }

    @Override
    public Node makeNode(final Node node, final ConsList<Node> children) {
        return asBranching(node).withChildren(children);
    }

    private static Node.Branching asBranching(final Node node) {
        if (node instanceof Node.Branching branching) {
            return branching;
        }
        throw new InvariantViolationError("A " + node.kind() + " node cannot have children");
    }
}
