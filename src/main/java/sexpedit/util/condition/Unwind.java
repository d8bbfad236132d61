// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util.condition;

/**
 * Throwable type used by the restart mechanism for transferring control flow to a given restart point.
 * <p>
 * Exposed so that functions can be marked as throwing {@code Unwind}; catching or throwing it manually is strongly
 * discouraged.
 * <p>
 * It isn't an error and isn't meant to be caught by generic exception handlers, so it extends neither
 * {@link Exception} nor {@link Error}, but {@link Throwable} directly.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
