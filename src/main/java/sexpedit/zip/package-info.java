// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Whitespace-aware navigation, insertion, search and editing of syntax trees.
 * <p>
 * Everything here works on {@code Location<Node>} cursors obtained from {@link sexpedit.zip.Zip#of(Node)}. Moves
 * transparently skip whitespace and comments, and insertions keep exactly one space between an inserted node and
 * its neighbours.
 */
@NonNullByDefault
package sexpedit.zip;

import sexpedit.tree.Node;
import sexpedit.util.annotation.NonNullByDefault;
