// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.test;

import java.nio.file.Path;
import bookbinder.document.DocumentLoadErrorCondition;
import bookbinder.document.DocumentLoader;
import bookbinder.document.Label;
import bookbinder.document.ParsedDocument;
import bookbinder.document.Section;
import bookbinder.document.SectionLinkingErrorCondition;
import bookbinder.io.FileOperationErrorCondition;
import bookbinder.io.NioFileOperations;
import bookbinder.util.condition.Condition;
import bookbinder.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class DocumentLoaderTest {
    @Test
    void sectionsAreBuiltInOrder() {
        final var document = load("book.json");
        assertThat(document.roots()).extracting(Section::identifier).containsExactly("1", "2");
        final var start = document.roots().get(0);
        assertThat(start.title()).isEqualTo("Getting Started");
        assertThat(start.label()).isEqualTo("Start");
        assertThat(start.children()).extracting(Section::identifier).containsExactly("1.1", "1.2");
        assertThat(start.children().get(1).label()).isNull();
    }

    @Test
    void labelsIncludeImplicitEntries() {
        final var document = load("book.json");
        final var labels = document.labels();
        assertThat(labels.get("Start")).isInstanceOfSatisfying(
            Label.SectionRef.class,
            ref -> assertThat(ref.section()).isSameAs(document.roots().get(0))
        );
        assertThat(labels.get("sec:physics")).isInstanceOfSatisfying(
            Label.SectionRef.class,
            ref -> assertThat(ref.section()).isSameAs(document.roots().get(1))
        );
        assertThat(labels.get("def:Package Manager")).isEqualTo(new Label.DefinitionRef("Package Manager"));
        assertThat(labels.get("eq:mass")).isEqualTo(new Label.ItemRef("(2.1)"));
        assertThat(labels.get("1.2")).isNull();
        assertThat(document.definitions().get("api")).isEqualTo("Application programming interface.");
    }

    @Test
    void missingOptionalFieldsDefault() {
        final var document = load("glossary.json");
        final var intro = document.roots().get(0);
        assertThat(intro.children()).isEmpty();
        assertThat(document.labels().asMap()).containsOnlyKeys("intro", "def:foo");
    }

    @Test
    void malformedJsonIsFatal() {
        assertThat(fatalConditionOf("malformed.json")).isInstanceOfSatisfying(
            DocumentLoadErrorCondition.class,
            condition -> {
                assertThat(condition.path()).isEqualTo(documentsPath.resolve("malformed.json"));
                assertThat(condition.detailedMessage()).contains(condition.exception().getClass().getName());
            }
        );
    }

    @Test
    void unknownFieldsAreFatal() {
        final var condition = fatalConditionOf("unknown-field.json");
        assertThat(condition).isInstanceOf(DocumentLoadErrorCondition.class);
        assertThat(condition.message()).contains("colour");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "duplicate-id.json",
        "dangling-label.json",
        "item-without-ordinal.json",
        "definition-label-without-name.json",
        "section-label-without-target.json",
        "empty-child-entry.json",
        "empty-root-entry.json",
    })
    void inconsistentDocumentsAreFatal(final String fileName) {
        assertThat(fatalConditionOf(fileName)).isInstanceOf(SectionLinkingErrorCondition.class);
    }

    @Test
    void labelMissingItsTargetFieldIsNamed() {
        assertThat(fatalConditionOf("item-without-ordinal.json").message()).isEqualTo("Label eq:1 has no ordinal");
        assertThat(fatalConditionOf("definition-label-without-name.json").message())
            .isEqualTo("Label glossary has no name");
    }

    @Test
    void emptyChildEntryNamesItsParent() {
        assertThat(fatalConditionOf("empty-child-entry.json").message()).contains("Section 1");
    }

    @Test
    void missingFileIsFatal() {
        assertThat(fatalConditionOf("no-such-document.json")).isInstanceOfSatisfying(
            FileOperationErrorCondition.class,
            condition -> assertThat(condition.path()).isEqualTo(documentsPath.resolve("no-such-document.json"))
        );
    }

    private static Condition fatalConditionOf(final String fileName) {
        final var error = catchThrowableOfType(() -> load(fileName), UnhandledErrorError.class);
        assertThat(error).isNotNull();
        return error.condition();
    }

    private static ParsedDocument load(final String fileName) {
        return new DocumentLoader(NioFileOperations.instance()).load(documentsPath.resolve(fileName));
    }

    private static final Path documentsPath = Path.of("src/test/resources/documents");
}
