// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

/**
 * A condition as seen by a handler.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff the condition was raised with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(Condition condition, boolean isFatal) {
}
