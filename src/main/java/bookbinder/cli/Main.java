// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.cli;

import java.nio.file.Path;
import bookbinder.assembly.LinkScheme;
import bookbinder.io.NioFileOperations;
import bookbinder.publisher.CommonmarkRenderer;
import bookbinder.publisher.PublishOrchestrator;
import bookbinder.publisher.PublishResult;
import bookbinder.util.UnreachableCodeReachedError;
import bookbinder.util.condition.ConditionContext;
import bookbinder.util.condition.Handler;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        if (args.length != 2 && args.length != 3) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Usage: bookbinder <input document> <output directory> [<link base>]");
                return ExitCode.USAGE;
            }
        }
        final var documentPath = Path.of(args[0]);
        final var targetPath = Path.of(args[1]);
        final var linkScheme = (args.length == 3) ? new LinkScheme(args[2]) : LinkScheme.relative();

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.<ExitCode>withRestart("abort-process", restart -> {
                final var orchestrator = new PublishOrchestrator(
                    targetPath,
                    linkScheme,
                    new CommonmarkRenderer(),
                    NioFileOperations.instance()
                );
                return report(orchestrator.publish(documentPath));
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static ExitCode report(final PublishResult result) {
        try (final var streams = Streams.acquire()) {
            if (result instanceof final PublishResult.Published published) {
                streams.out().println(
                    "Published " + published.pageCount() + " pages to " + published.target()
                );
                return ExitCode.SUCCESS;
            } else if (result instanceof final PublishResult.Failed failed) {
                final var err = streams.err();
                err.println("Publishing failed: " + failed.message());
                err.println("\nOperation trace:");
                for (final var traceMessage : failed.operationTrace()) {
                    err.println(" - " + traceMessage);
                }
                return ExitCode.ERROR;
            } else {
                throw new UnreachableCodeReachedError();
            }
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
