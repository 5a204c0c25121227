// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

/**
 * The procedure of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Looks at the given condition.
     * <p>
     * Returning normally declines to handle it, and older handlers get to see it next. Handling it means transferring
     * control elsewhere, typically with {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
