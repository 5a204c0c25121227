// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

import org.jetbrains.annotations.Nullable;

/**
 * A condition handler, established with try-with-resources.
 * <p>
 * Signaled conditions are offered to the established handlers from the most recent to the oldest.
 */
public final class Handler implements AutoCloseable {
    /**
     * Establishes a handler running the given procedure in the calling thread's {@link ConditionContext}.
     */
    public Handler(final HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; referencing the resource silences unused-variable warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Disestablishes the handler.
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
