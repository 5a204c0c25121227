// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that code further up the call stack may care about: a dangling cross-reference,
 * a skipped section, a file that couldn't be written. Handlers see it <em>before</em> the stack is unwound, so they
 * can decide whether to carry on or transfer control to a restart point.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves a longer message, for instance including the stack trace of an underlying exception.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
