// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.io;

import java.nio.file.Path;

/**
 * The file system as seen by the publishing pipeline.
 * <p>
 * Every operation takes the full path it acts on; nothing is resolved against a working directory. Operations are
 * synchronous, and on failure signal {@link FileOperationErrorCondition} as a fatal condition.
 */
public interface FileOperations {
    /**
     * Creates the directory at the given path, along with any missing parents.
     */
    void createDirectory(Path path);

    /**
     * Removes the file or directory tree at the given path. Does nothing if the path doesn't exist.
     */
    void removeRecursively(Path path);

    /**
     * Writes the given string as UTF-8, replacing any previous file content.
     */
    void writeString(Path path, String content);

    /**
     * Reads the file at the given path as UTF-8.
     */
    String readString(Path path);

    /**
     * Renames the file or directory at {@code source} to {@code target} in one atomic step. The target must not exist.
     */
    void move(Path source, Path target);
}
