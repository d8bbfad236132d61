// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zipper;

import java.util.Optional;

/**
 * A way of moving a cursor, such as {@link Location#right()}, that may fail.
 *
 * @param <N> the node type
 */
@FunctionalInterface
public interface Movement<N> {
    /**
     * Moves the given cursor, returning an empty optional if the move is impossible.
     */
    Optional<Location<N>> move(Location<N> location);
}
