// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Diagnostics that must not stop a run are <em>signaled</em>; failures are raised with
 * {@link bookbinder.util.condition.ConditionContext#error(Condition)} and handled by unwinding to a restart point.
 */
@NonNullByDefault
package bookbinder.util.condition;

import bookbinder.util.annotation.NonNullByDefault;
