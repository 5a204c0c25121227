// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import bookbinder.assembly.CrossReferenceResolver;
import bookbinder.assembly.LinkScheme;
import bookbinder.document.DefinitionTable;
import bookbinder.document.Label;
import bookbinder.document.LabelTable;
import bookbinder.document.Section;
import bookbinder.io.NioFileOperations;
import bookbinder.publisher.CommonmarkRenderer;
import bookbinder.publisher.DictionaryBuilder;
import bookbinder.publisher.MarkdownRenderer;
import bookbinder.publisher.OutputNamingErrorCondition;
import bookbinder.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class DictionaryBuilderTest {
    @Test
    void entriesAreSortedIgnoringCase() {
        final var definitions = new LinkedHashMap<String, String>();
        definitions.put("Zeta", "Last letter.");
        definitions.put("alpha", "First letter.");
        definitions.put("Beta", "Second letter.");
        final var html = builder(LabelTable.empty(), identity).build(DefinitionTable.of(definitions));
        assertThat(html).isEqualTo(
            "<h2 id=\"alpha\">alpha</h2>\nFirst letter.\n\n"
                + "<h2 id=\"beta\">Beta</h2>\nSecond letter.\n\n"
                + "<h2 id=\"zeta\">Zeta</h2>\nLast letter."
        );
    }

    @Test
    void namesDifferingOnlyInCaseHaveStableOrder() {
        final var forward = new LinkedHashMap<String, String>();
        forward.put("foo", "lower");
        forward.put("Foo", "upper");
        final var backward = new LinkedHashMap<String, String>();
        backward.put("Foo", "upper");
        backward.put("foo", "lower");
        final var builder = builder(LabelTable.empty(), identity);
        assertThat(builder.build(DefinitionTable.of(forward))).isEqualTo(builder.build(DefinitionTable.of(backward)));
    }

    @Test
    void anchorsMatchDefinitionUrls() {
        final var html = builder(LabelTable.empty(), identity).build(DefinitionTable.of(Map.of("Big Deal", "Huge.")));
        assertThat(html).startsWith("<h2 id=\"big-deal\">Big Deal</h2>");
        assertThat(new LinkScheme("/x/").definitionUrl("Big Deal")).endsWith("#big-deal");
    }

    @Test
    void definitionsAreResolvedAndRendered() {
        final var section = new Section("1", "Intro", "", "intro", List.of());
        final var labels = LabelTable.of(Map.of("sec:intro", new Label.SectionRef(section)));
        final var html = builder(labels, new CommonmarkRenderer())
            .build(DefinitionTable.of(Map.of("foo", "See ~~~sec:intro~~~ & more.")));
        assertThat(html).isEqualTo("<h2 id=\"foo\">foo</h2>\n<p>See <a href=\"intro.html\">Intro</a> &amp; more.</p>");
    }

    @Test
    void namesSharingAnAnchorAreFatal(@TempDir final Path directory) {
        final var definitions = new LinkedHashMap<String, String>();
        definitions.put("Foo Bar", "Spaced.");
        definitions.put("foo-bar", "Hyphenated.");
        final var error = catchThrowableOfType(
            () -> builder(LabelTable.empty(), identity).write(DefinitionTable.of(definitions), directory),
            UnhandledErrorError.class
        );
        assertThat(error).isNotNull();
        assertThat(error.condition()).isInstanceOf(OutputNamingErrorCondition.class);
        assertThat(error.condition().message()).contains("Foo Bar").contains("foo-bar").contains("anchor foo-bar");
        assertThat(directory.resolve("dictionary.html")).doesNotExist();
    }

    @Test
    void namesAreEscaped() {
        final var html = builder(LabelTable.empty(), identity).build(DefinitionTable.of(Map.of("a<b", "x")));
        assertThat(html).startsWith("<h2 id=\"a&lt;b\">a&lt;b</h2>");
    }

    @Test
    void emptyTableGivesEmptyDictionary(@TempDir final Path directory) throws IOException {
        final var path = builder(LabelTable.empty(), identity).write(DefinitionTable.empty(), directory);
        assertThat(path).isEqualTo(directory.resolve("dictionary.html"));
        assertThat(Files.readString(path, StandardCharsets.UTF_8)).isEmpty();
    }

    private static DictionaryBuilder builder(final LabelTable labels, final MarkdownRenderer renderer) {
        final var resolver = new CrossReferenceResolver(labels, LinkScheme.relative());
        return new DictionaryBuilder(resolver, renderer, NioFileOperations.instance());
    }

    private static final MarkdownRenderer identity = markdown -> markdown;
}
