// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.test;

import java.io.IOException;
import java.nio.file.Path;
import bookbinder.io.FileOperationErrorCondition;
import bookbinder.io.FileOperations;
import bookbinder.io.NioFileOperations;
import bookbinder.util.condition.ConditionContext;

// Works on the real file system, except that writing a file with the given name fails.
final class FailingFileOperations implements FileOperations {
    FailingFileOperations(final String failingFileName) {
        this.failingFileName = failingFileName;
    }

    @Override
    public void createDirectory(final Path path) {
        delegate.createDirectory(path);
    }

    @Override
    public void removeRecursively(final Path path) {
        delegate.removeRecursively(path);
    }

    @Override
    public void writeString(final Path path, final String content) {
        final var fileName = path.getFileName();
        if (fileName != null && fileName.toString().equals(failingFileName)) {
            throw ConditionContext.error(
                new FileOperationErrorCondition("write", path, new IOException("Disk full"))
            );
        }
        delegate.writeString(path, content);
    }

    @Override
    public String readString(final Path path) {
        return delegate.readString(path);
    }

    @Override
    public void move(final Path source, final Path target) {
        delegate.move(source, target);
    }

    private final String failingFileName;
    private final FileOperations delegate = NioFileOperations.instance();
}
