// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler returned normally.
 * <p>
 * Every entry point establishes a handler that unwinds on fatal conditions, so this is a programming error.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
