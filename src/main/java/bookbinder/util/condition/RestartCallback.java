// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

/**
 * The body executed by {@link ConditionContext#withRestart(String, RestartCallback)}, receiving the restart point
 * established around it.
 */
@FunctionalInterface
public interface RestartCallback<T> {
    @SuppressWarnings("RedundantThrows")
    T call(Restart<T> restart) throws Unwind;
}
