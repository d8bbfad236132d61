// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler transferred control in response to a fatal
 * condition.
 * <p>
 * The condition stays reachable through {@link #condition()}, so callers that expect failures can still inspect it.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the fatal condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
