// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import java.nio.file.Path;
import java.util.function.Supplier;
import bookbinder.assembly.CrossReferenceResolver;
import bookbinder.assembly.LinkScheme;
import bookbinder.assembly.SectionTreeWalker;
import bookbinder.document.DocumentLoader;
import bookbinder.document.ParsedDocument;
import bookbinder.io.FileOperations;
import bookbinder.util.PathUtils;
import bookbinder.util.Trace;
import bookbinder.util.UnreachableCodeReachedError;
import bookbinder.util.condition.ConditionContext;
import bookbinder.util.condition.Handler;
import bookbinder.util.condition.Restart;
import bookbinder.util.condition.SignaledCondition;

/**
 * The entry point to publishing proper.
 * <p>
 * A run builds the complete output in a staging directory next to the target, named after it with a
 * {@code .staging} suffix, and only then replaces the target with it:
 * <ul>
 * <li>Preparing an empty staging directory, removing leftovers of an earlier failed run,
 * <li>Flattening the section tree and resolving cross-references,
 * <li>Writing one page record per section,
 * <li>Writing the dictionary,
 * <li>Writing the navigation index,
 * <li>Removing the old target and renaming the staging directory to the target.
 * </ul>
 * <p>
 * Every fatal condition signaled during a run aborts it, and is reported as {@link PublishResult.Failed}. Until the
 * final step the target isn't touched, so a failed run leaves the previous output in place. Non-fatal conditions,
 * like unresolved cross-references, are left to the caller's handlers.
 * <p>
 * Runs against the same target must not overlap.
 */
public final class PublishOrchestrator {
    /**
     * Initializes an orchestrator publishing to the given target directory.
     */
    public PublishOrchestrator(
        final Path target,
        final LinkScheme linkScheme,
        final MarkdownRenderer renderer,
        final FileOperations files
    ) {
        this.target = target.toAbsolutePath().normalize();
        this.linkScheme = linkScheme;
        this.renderer = renderer;
        this.files = files;
        stagingDirectory = PathUtils.siblingWithSuffix(this.target, stagingSuffix);
    }

    /**
     * Loads the document at the given path and publishes it. If loading fails, nothing is staged.
     */
    public PublishResult publish(final Path documentPath) {
        return runAborting(() -> publishImpl(new DocumentLoader(files).load(documentPath)));
    }

    /**
     * Publishes the given document.
     * <p>
     * Section content is normalized in place while publishing.
     */
    public PublishResult publish(final ParsedDocument document) {
        return runAborting(() -> publishImpl(document));
    }

    /**
     * Retrieves the directory the output is assembled in before it replaces the target.
     */
    public Path stagingDirectory() {
        return stagingDirectory;
    }

    private PublishResult.Published publishImpl(final ParsedDocument document) {
        try (final var trace = new Trace(() -> "Publishing to " + target)) {
            trace.use();
            prepareStagingDirectory();
            final var resolver = new CrossReferenceResolver(document.labels(), linkScheme);
            final var flattened = new SectionTreeWalker(resolver, linkScheme).flatten(document.roots());
            final var pages = new PageEmitter(renderer, linkScheme, files).emit(flattened.sections(), stagingDirectory);
            new DictionaryBuilder(resolver, renderer, files).write(document.definitions(), stagingDirectory);
            new NavigationRenderer(files).write(flattened.navigation(), stagingDirectory);
            promoteStagingDirectory();
            return new PublishResult.Published(target, pages.size());
        }
    }

    private void prepareStagingDirectory() {
        try (final var trace = new Trace(() -> "Preparing staging directory " + stagingDirectory)) {
            trace.use();
            files.removeRecursively(stagingDirectory);
            files.createDirectory(stagingDirectory);
        }
    }

    private void promoteStagingDirectory() {
        try (final var trace = new Trace(() -> "Replacing " + target + " with " + stagingDirectory)) {
            trace.use();
            files.removeRecursively(target);
            files.move(stagingDirectory, target);
        }
    }

    private static PublishResult runAborting(final Supplier<PublishResult.Published> body) {
        final var result = ConditionContext.<PublishResult>withRestart("abort-publish", restart -> {
            try (final var handler = new Handler(condition -> abortOnFatal(condition, restart))) {
                handler.use();
                return body.get();
            }
        });
        if (result == null) {
            throw new UnreachableCodeReachedError("Publishing aborted without a report");
        }
        return result;
    }

    // The traces are collected before unwinding closes them.
    private static void abortOnFatal(final SignaledCondition signaled, final Restart<PublishResult> restart) {
        if (signaled.isFatal()) {
            restart.unwindWith(new PublishResult.Failed(signaled.condition().message(), Trace.activeTraces()));
        }
    }

    static final String stagingSuffix = ".staging";

    private final Path target;
    private final Path stagingDirectory;
    private final LinkScheme linkScheme;
    private final MarkdownRenderer renderer;
    private final FileOperations files;
}
