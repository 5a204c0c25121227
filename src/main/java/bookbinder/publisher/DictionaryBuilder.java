// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import bookbinder.assembly.CrossReferenceResolver;
import bookbinder.assembly.LinkScheme;
import bookbinder.document.DefinitionTable;
import bookbinder.dom.Attribute;
import bookbinder.dom.Node;
import bookbinder.dom.Serializer;
import bookbinder.dom.Tag;
import bookbinder.io.FileOperations;
import bookbinder.util.Trace;
import bookbinder.util.condition.ConditionContext;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Renders the glossary: every definition under a heading that cross-references can link to, ordered by name
 * regardless of letter case.
 * <p>
 * Two definitions whose names map to the same anchor, such as {@code Big Deal} and {@code big-deal}, signal a fatal
 * {@link OutputNamingErrorCondition}.
 */
public final class DictionaryBuilder {
    /**
     * Initializes a builder resolving definitions with {@code resolver}, rendering them with {@code renderer}, and
     * writing through {@code files}.
     */
    public DictionaryBuilder(
        final CrossReferenceResolver resolver,
        final MarkdownRenderer renderer,
        final FileOperations files
    ) {
        this.resolver = resolver;
        this.renderer = renderer;
        this.files = files;
    }

    /**
     * Returns the glossary markup of the given definitions.
     */
    @CheckReturnValue
    public String build(final DefinitionTable definitions) {
        final var entries = new ArrayList<>(definitions.asMap().entrySet());
        entries.sort(Map.Entry.comparingByKey(byName));
        checkAnchorsUnique(entries);
        final var blocks = new ArrayList<String>(entries.size());
        for (final var entry : entries) {
            blocks.add(buildEntry(entry.getKey(), entry.getValue()));
        }
        return String.join(blockSeparator, blocks);
    }

    /**
     * Writes the glossary of the given definitions into the given directory.
     *
     * @return The path of the written glossary.
     */
    public Path write(final DefinitionTable definitions, final Path directory) {
        try (final var trace = new Trace("Building the dictionary")) {
            trace.use();
            final var path = directory.resolve(LinkScheme.dictionaryFileName);
            files.writeString(path, build(definitions));
            return path;
        }
    }

    private static void checkAnchorsUnique(final List<Map.Entry<String, String>> entries) {
        final var owners = new HashMap<String, String>();
        for (final var entry : entries) {
            final var name = entry.getKey();
            final var anchor = LinkScheme.anchor(name);
            final var previous = owners.putIfAbsent(anchor, name);
            if (previous != null) {
                throw ConditionContext.error(new OutputNamingErrorCondition(
                    "Definitions " + previous + " and " + name + " share the anchor " + anchor
                ));
            }
        }
    }

    private String buildEntry(final String name, final String definition) {
        try (final var trace = new Trace(() -> "Rendering definition " + name)) {
            trace.use();
            final var heading = new Node.Element(
                Tag.H2,
                List.of(new Attribute("id", LinkScheme.anchor(name))),
                List.of(new Node.Text(name))
            );
            return Serializer.serializeToString(heading) + '\n' + renderer.render(resolver.resolve(definition));
        }
    }

    // Case-insensitive first; exact comparison breaks ties so that "Foo" and "foo" always come out the same way.
    private static final Comparator<String> byName =
        String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());
    private static final String blockSeparator = "\n\n";

    private final CrossReferenceResolver resolver;
    private final MarkdownRenderer renderer;
    private final FileOperations files;
}
