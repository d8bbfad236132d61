// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util.condition;

import sexpedit.util.annotation.Nullable;

/**
 * A condition handler, intended to be used within try-with-resources.
 * <p>
 * Whenever a condition is signaled, the procedures of all installed handlers run in order from the last installed
 * to the first, until one of them transfers control.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a new handler with the given procedure in the current thread's {@link ConditionContext}.
     */
    public Handler(final HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing. Silences compiler warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Uninstalls the handler.
     */
    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final HandlerProcedure procedure;
    private final ConditionContext ownerContext;
}
