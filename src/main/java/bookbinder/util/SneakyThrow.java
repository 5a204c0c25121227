// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util;

import org.jetbrains.annotations.NotNull;

/**
 * Rethrows checked throwables without declaring them.
 * <p>
 * Only {@link bookbinder.util.condition.Unwind} and {@link InterruptedException} are meant to travel this way.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked.
     * <p>
     * Never returns; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(e)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast vanishes from bytecode, while javac infers E as RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
