// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import bookbinder.util.condition.ExceptionCondition;

/**
 * A condition type indicating that content couldn't be converted into its published form: markdown into HTML, or a
 * page into JSON.
 */
public final class RenderErrorCondition extends ExceptionCondition<Exception> {
    /**
     * Initializes a new condition describing what couldn't be rendered, and why.
     */
    public RenderErrorCondition(final String what, final Exception exception) {
        super("Cannot render " + what + ": " + exception, exception);
    }
}
