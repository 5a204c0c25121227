// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util;

import java.nio.file.Path;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Miscellaneous operations on paths.
 */
public final class PathUtils {
    private PathUtils() {
    }

    /**
     * Replaces the extension of the given path's file name with the given one, or appends it if there's none.
     * <p>
     * A path with no file name is returned unchanged.
     */
    @CheckReturnValue
    public static Path changeExtension(final Path path, final String newExtension) {
        final var fileName = path.getFileName();
        if (fileName == null) {
            return path;
        }
        final var nameString = fileName.toString();
        final var dotIndex = nameString.lastIndexOf('.');
        final var newNameString = (dotIndex == -1)
            ? (nameString + '.' + newExtension)
            : (nameString.substring(0, dotIndex + 1) + newExtension);
        final var parent = path.getParent();
        return (parent == null)
            ? path.getFileSystem().getPath(newNameString)
            : parent.resolve(newNameString);
    }

    /**
     * Returns a path whose file name is the given one's followed by {@code suffix}, in the same parent directory.
     */
    @CheckReturnValue
    public static Path siblingWithSuffix(final Path path, final String suffix) {
        final var fileName = path.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Path has no file name: " + path);
        }
        return path.resolveSibling(fileName + suffix);
    }
}
