// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import bookbinder.assembly.LinkScheme;
import bookbinder.document.Section;
import bookbinder.io.FileOperations;
import bookbinder.util.PathUtils;
import bookbinder.util.Trace;
import bookbinder.util.condition.ConditionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds and stores one {@link Page} per flattened section, chaining each page to its neighbours in the sequence.
 * <p>
 * A page is stored as JSON next to where its url points, with the extension swapped: the section linked as
 * {@code intro.html} is stored in {@code intro.json}. Any failure to render or store a page is fatal.
 * <p>
 * Every page must land directly in the output directory under a file name of its own. A label that would escape the
 * directory or isn't a valid file name, or two labels naming the same file, signal a fatal
 * {@link OutputNamingErrorCondition} before anything is written.
 */
public final class PageEmitter {
    /**
     * Initializes an emitter rendering content with {@code renderer}, linking with {@code linkScheme}, and writing
     * through {@code files}.
     */
    public PageEmitter(final MarkdownRenderer renderer, final LinkScheme linkScheme, final FileOperations files) {
        this.renderer = renderer;
        this.linkScheme = linkScheme;
        this.files = files;
    }

    /**
     * Builds the pages of the given sections, in order.
     */
    @CheckReturnValue
    public List<Page> buildPages(final List<Section> sections) {
        final var pages = new ArrayList<Page>(sections.size());
        @Nullable Section predecessor = null;
        for (final var it = sections.listIterator(); it.hasNext(); ) {
            final var section = it.next();
            final var successor = it.hasNext() ? sections.get(it.nextIndex()) : null;
            pages.add(buildPage(section, predecessor, successor));
            predecessor = section;
        }
        return pages;
    }

    /**
     * Builds the pages of the given sections and writes each to the given directory.
     *
     * @return The pages written.
     */
    public List<Page> emit(final List<Section> sections, final Path directory) {
        try (final var trace = new Trace(() -> "Emitting " + sections.size() + " page(s) to " + directory)) {
            trace.use();
            final var paths = checkedPagePaths(sections, directory);
            final var pages = buildPages(sections);
            for (int i = 0; i < pages.size(); i += 1) {
                writePage(pages.get(i), paths.get(i));
            }
            return pages;
        }
    }

    /**
     * Returns where the page of the given section is stored below {@code directory}.
     */
    public static Path pagePath(final Path directory, final Section section) {
        final var relativeUrl = LinkScheme.relative().sectionUrl(section);
        if (relativeUrl == null) {
            throw new IllegalArgumentException("Section " + section.identifier() + " has no label");
        }
        return PathUtils.changeExtension(directory.resolve(relativeUrl), pageExtension);
    }

    private static List<Path> checkedPagePaths(final List<Section> sections, final Path directory) {
        final var expectedParent = directory.toAbsolutePath().normalize();
        final var owners = new HashMap<Path, Section>();
        final var paths = new ArrayList<Path>(sections.size());
        for (final var section : sections) {
            final Path path;
            try {
                path = pagePath(directory, section);
            } catch (final InvalidPathException e) {
                throw ConditionContext.error(new OutputNamingErrorCondition(
                    "Label " + section.label() + " of section " + section.identifier() + " is not a valid file name"
                ));
            }
            final var normalized = path.toAbsolutePath().normalize();
            if (!expectedParent.equals(normalized.getParent())) {
                throw ConditionContext.error(new OutputNamingErrorCondition(
                    "Label " + section.label() + " of section " + section.identifier() + " would place its page at "
                        + normalized + ", outside " + expectedParent
                ));
            }
            final var previous = owners.putIfAbsent(normalized, section);
            if (previous != null) {
                throw ConditionContext.error(new OutputNamingErrorCondition(
                    "Sections " + previous.identifier() + " and " + section.identifier() + " would both be stored in "
                        + normalized
                ));
            }
            paths.add(path);
        }
        return paths;
    }

    private Page buildPage(
        final Section section,
        final @Nullable Section predecessor,
        final @Nullable Section successor
    ) {
        try (final var trace = new Trace(() -> "Building page of section " + section.identifier())) {
            trace.use();
            return new Page(
                section.identifier(),
                section.title(),
                renderer.render(section.content()),
                (predecessor == null) ? null : linkScheme.sectionUrl(predecessor),
                (predecessor == null) ? null : predecessor.title(),
                (successor == null) ? null : linkScheme.sectionUrl(successor),
                (successor == null) ? null : successor.title()
            );
        }
    }

    private void writePage(final Page page, final Path path) {
        final String json;
        try {
            json = pageWriter.writeValueAsString(page);
        } catch (final JsonProcessingException e) {
            throw ConditionContext.error(new RenderErrorCondition("page " + page.id(), e));
        }
        files.writeString(path, json + '\n');
    }

    static final String pageExtension = "json";

    // Fixed line separators keep the output identical across platforms.
    private static final ObjectWriter pageWriter = JsonMapper.builder().build().writer(
        new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", "\n"))
    );

    private final MarkdownRenderer renderer;
    private final LinkScheme linkScheme;
    private final FileOperations files;
}
