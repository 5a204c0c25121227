// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * A condition caused by a caught exception, which it reports in its detailed message.
 */
public abstract class ExceptionCondition<E extends Exception> extends Condition {
    /**
     * Initializes a new condition with the given message, caused by the given exception.
     */
    protected ExceptionCondition(final String message, final E exception) {
        super(message);
        this.exception = exception;
    }

    /**
     * Retrieves the exception that caused this condition.
     */
    public final E exception() {
        return exception;
    }

    @Override
    public String detailedMessage() {
        final var charset = StandardCharsets.UTF_8;
        final var stream = new ByteArrayOutputStream();
        final var printStream = new PrintStream(stream, false, charset);
        printStream.println(message());
        exception.printStackTrace(printStream);
        printStream.flush();
        return stream.toString(charset);
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message() + " (" + exception + ')';
    }

    private final E exception;
}
