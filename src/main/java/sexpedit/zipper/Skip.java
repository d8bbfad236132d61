// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zipper;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * The "keep moving while" combinator that whitespace skipping and searching are built on.
 */
public final class Skip {
    private Skip() {
    }

    /**
     * Starting at {@code start}, applies {@code move} for as long as {@code shouldSkip} holds.
     * <p>
     * Returns the first location for which {@code shouldSkip} is {@code false}, which is {@code start} itself if it
     * doesn't need skipping, or an empty optional as soon as {@code move} fails. Locations are visited one at a time;
     * nothing past the returned location is ever computed.
     */
    public static <N> Optional<Location<N>> skip(
        final Movement<N> move,
        final Predicate<? super Location<N>> shouldSkip,
        final Location<N> start
    ) {
        var current = start;
        while (shouldSkip.test(current)) {
            final var moved = move.move(current);
            if (moved.isEmpty()) {
                return moved;
            }
            current = moved.get();
        }
        return Optional.of(current);
    }

    /**
     * Like {@link #skip(Movement, Predicate, Location)}, but starting from a location that may be absent, in which
     * case the result is absent too.
     */
    public static <N> Optional<Location<N>> skip(
        final Movement<N> move,
        final Predicate<? super Location<N>> shouldSkip,
        final Optional<Location<N>> start
    ) {
        return start.flatMap(location -> skip(move, shouldSkip, location));
    }
}
