// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A generic persistent cursor ("zipper") over immutable trees.
 * <p>
 * The zipper knows nothing about the shape of the nodes it walks: a {@link sexpedit.zipper.TreeAdapter} tells it
 * which nodes have children, what they are, and how to rebuild a node with new ones. Failure to move is reported
 * with an empty {@link java.util.Optional}, never with an exception.
 */
@NonNullByDefault
package sexpedit.zipper;

import sexpedit.util.annotation.NonNullByDefault;
