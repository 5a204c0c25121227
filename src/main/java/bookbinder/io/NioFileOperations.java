// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import bookbinder.util.Trace;
import bookbinder.util.condition.ConditionContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * {@link FileOperations} on the default file system, through {@link Files}.
 */
public final class NioFileOperations implements FileOperations {
    private NioFileOperations() {
    }

    /**
     * Returns the shared instance.
     */
    public static NioFileOperations instance() {
        return instance;
    }

    @Override
    public void createDirectory(final Path path) {
        try (final var trace = new Trace(() -> "Creating directory " + path)) {
            trace.use();
            Files.createDirectories(path);
        } catch (final IOException e) {
            throw ConditionContext.error(new FileOperationErrorCondition("create directory", path, e));
        }
    }

    @Override
    public void removeRecursively(final Path path) {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try (final var trace = new Trace(() -> "Removing " + path)) {
            trace.use();
            Files.walkFileTree(path, new RemovingFileVisitor());
        } catch (final IOException e) {
            throw ConditionContext.error(new FileOperationErrorCondition("remove", path, e));
        }
    }

    @Override
    public void writeString(final Path path, final String content) {
        try (final var trace = new Trace(() -> "Writing " + path)) {
            trace.use();
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw ConditionContext.error(new FileOperationErrorCondition("write", path, e));
        }
    }

    @Override
    public String readString(final Path path) {
        try (final var trace = new Trace(() -> "Reading " + path)) {
            trace.use();
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw ConditionContext.error(new FileOperationErrorCondition("read", path, e));
        }
    }

    @Override
    public void move(final Path source, final Path target) {
        try (final var trace = new Trace(() -> "Moving " + source + " to " + target)) {
            trace.use();
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException e) {
            throw ConditionContext.error(new FileOperationErrorCondition("move " + source + " to", target, e));
        }
    }

    private static final NioFileOperations instance = new NioFileOperations();

    // Deletes children before their parent directory; symbolic links are removed, not followed.
    private static final class RemovingFileVisitor extends SimpleFileVisitor<Path> {
        @Override
        public @NotNull FileVisitResult visitFile(
            final @NotNull Path filePath,
            final @NotNull BasicFileAttributes attributes
        ) throws IOException {
            Files.delete(filePath);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public @NotNull FileVisitResult postVisitDirectory(
            final @NotNull Path directoryPath,
            final @Nullable IOException exception
        ) throws IOException {
            if (exception != null) {
                throw exception;
            }
            Files.delete(directoryPath);
            return FileVisitResult.CONTINUE;
        }
    }
}
