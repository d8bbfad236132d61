// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * Unlike exceptions, condition handlers run <em>before</em> the stack is unwound, so a handler can see the restart
 * points established by the code that signaled the condition, and pick one of them.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message representing this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full, detailed, user-readable message representing this condition.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
