// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util;

import org.jetbrains.annotations.NotNull;

/**
 * Error type signifying that a structural invariant of a tree or a cursor was violated, for example a node without
 * children being asked to be rebuilt with a new child list.
 * <p>
 * Since this represents a programming error rather than a recoverable failure, this class extends
 * {@link AssertionError}.
 */
public final class InvariantViolationError extends AssertionError {
    public InvariantViolationError(final @NotNull String message) {
        super(message);
    }
}
