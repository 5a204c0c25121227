// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown at the end of an exhaustive {@code instanceof} chain over a sealed type, when none of the permitted
 * subtypes matched.
 * <p>
 * Reaching one is a programming error, hence the {@link AssertionError} supertype.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
