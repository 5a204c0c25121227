// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

import bookbinder.util.SneakyThrow;
import org.jetbrains.annotations.Nullable;

/**
 * A restart point established by {@link ConditionContext#withRestart(String, RestartCallback)}.
 * <p>
 * Unwinding to a restart point makes its {@code withRestart} call return: either {@code null}, or a value supplied
 * by whoever unwinds, such as a report of what went wrong.
 *
 * @param <T> The type of the values {@code withRestart} returns.
 */
public final class Restart<T> {
    Restart(final String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    /**
     * Retrieves the user-readable name of this restart point, such as {@code abort-publish}.
     */
    public String name() {
        return name;
    }

    /**
     * Transfers control to this restart point, making it return {@code null}. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this, null));
    }

    /**
     * Transfers control to this restart point, making it return the given value. Never returns.
     */
    public void unwindWith(final T value) {
        throw SneakyThrow.doThrow(new Unwind(this, value));
    }

    void unlink() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert ownerContext.firstRestart == this : "Restart chain corrupt";
        ownerContext.firstRestart = next;
    }

    // Only the Unwind created by this restart's own methods gets here, so the value is a T.
    @SuppressWarnings("unchecked")
    @Nullable T valueOf(final Unwind unwind) {
        return (T) unwind.value();
    }

    final @Nullable Restart<?> next;
    private final String name;
    private final ConditionContext ownerContext;
}
