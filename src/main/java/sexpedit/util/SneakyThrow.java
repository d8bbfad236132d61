// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util;

import org.jetbrains.annotations.NotNull;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as an <em>unchecked exception</em>, no matter its static nor dynamic type.
     * <p>
     * The only intended use is propagating {@link sexpedit.util.condition.Unwind} through code that is not declared
     * to throw it.
     * <p>
     * Since this method never returns normally, it's declared to return {@link InvariantViolationError} that can be
     * "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static @NotNull InvariantViolationError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast doesn't exist in bytecode; callers see a RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull InvariantViolationError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
