// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.io;

import java.io.IOException;
import java.nio.file.Path;
import bookbinder.util.condition.ExceptionCondition;

/**
 * A condition type indicating that a file operation failed.
 */
public final class FileOperationErrorCondition extends ExceptionCondition<IOException> {
    /**
     * Initializes a new condition describing the failed operation, such as "write", on the given path.
     */
    public FileOperationErrorCondition(final String operation, final Path path, final IOException exception) {
        super("Cannot " + operation + ' ' + path + ": " + exception, exception);
        this.path = path;
    }

    /**
     * Retrieves the path the failed operation acted on.
     */
    public Path path() {
        return path;
    }

    private final Path path;
}
