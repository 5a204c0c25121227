// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

import org.jetbrains.annotations.Nullable;

/**
 * The throwable carrying control, and optionally a value, from a {@link Restart} to the matching
 * {@link ConditionContext#withRestart(String, RestartCallback)}.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}, so ordinary {@code catch} blocks let it through. Don't
 * catch it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart<?> target, final @Nullable Object value) {
        super("Unwinding to restart point " + target.name(), null, false, false);
        this.target = target;
        this.value = value;
    }

    Restart<?> target() {
        return target;
    }

    @Nullable Object value() {
        return value;
    }

    private final transient Restart<?> target;
    private final transient @Nullable Object value;
}
