// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;
import bookbinder.assembly.LinkScheme;
import bookbinder.document.Section;
import bookbinder.io.NioFileOperations;
import bookbinder.publisher.OutputNamingErrorCondition;
import bookbinder.publisher.Page;
import bookbinder.publisher.PageEmitter;
import bookbinder.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class PageEmitterTest {
    static LongStream provideSeeds() {
        return RandomUtils.provideSeeds();
    }

    @Test
    void pagesAreChained() {
        final var sections = List.of(
            section("1", "One", "one"),
            section("2", "Two", "two"),
            section("3", "Three", "three")
        );
        final var pages = emitter(new LinkScheme("/b/")).buildPages(sections);
        assertThat(pages).containsExactly(
            new Page("1", "One", "<one>", null, null, "/b/two.html", "Two"),
            new Page("2", "Two", "<two>", "/b/one.html", "One", "/b/three.html", "Three"),
            new Page("3", "Three", "<three>", "/b/two.html", "Two", null, null)
        );
    }

    @Test
    void singlePageHasNoNeighbours() {
        final var pages = emitter(LinkScheme.relative()).buildPages(List.of(section("1", "Only", "only")));
        assertThat(pages).singleElement().satisfies(page -> {
            assertThat(page.prev()).isNull();
            assertThat(page.next()).isNull();
        });
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void chainHoldsForAnyLength(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var count = random.nextInt(1, 50);
        final var sections = new ArrayList<Section>(count);
        for (int i = 0; i < count; i += 1) {
            sections.add(section(Integer.toString(i), "Title " + i, "s" + i));
        }
        final var linkScheme = LinkScheme.relative();
        final var pages = emitter(linkScheme).buildPages(sections);
        assertThat(pages).hasSize(count);
        assertThat(pages.get(0).prev()).isNull();
        assertThat(pages.get(count - 1).next()).isNull();
        for (int i = 1; i < count; i += 1) {
            assertThat(pages.get(i).prev()).isEqualTo(linkScheme.sectionUrl(sections.get(i - 1)));
            assertThat(pages.get(i).prevTitle()).isEqualTo(sections.get(i - 1).title());
            assertThat(pages.get(i - 1).next()).isEqualTo(linkScheme.sectionUrl(sections.get(i)));
            assertThat(pages.get(i - 1).nextTitle()).isEqualTo(sections.get(i).title());
        }
    }

    @Test
    void pagePathFollowsLabel() {
        final var directory = Path.of("out");
        assertThat(PageEmitter.pagePath(directory, section("1", "Intro", "Intro")))
            .isEqualTo(directory.resolve("intro.json"));
    }

    @Test
    void pagesAreWrittenAsJson(@TempDir final Path directory) throws IOException {
        final var sections = List.of(section("1", "One", "one"), section("2", "Two", "two"));
        emitter(LinkScheme.relative()).emit(sections, directory);
        final var expected = """
            {
              "id" : "1",
              "title" : "One",
              "content" : "<one>",
              "prev" : null,
              "prevTitle" : null,
              "next" : "two.html",
              "nextTitle" : "Two"
            }
            """;
        assertThat(Files.readString(directory.resolve("one.json"), StandardCharsets.UTF_8)).isEqualTo(expected);
        assertThat(directory.resolve("two.json")).exists();
    }

    @Test
    void labelEscapingDirectoryIsFatal(@TempDir final Path directory) throws IOException {
        final var output = Files.createDirectories(directory.resolve("out"));
        final var sections = List.of(section("1", "Fine", "fine"), section("2", "Escape", "../escaped"));
        final var error = catchThrowableOfType(
            () -> emitter(LinkScheme.relative()).emit(sections, output),
            UnhandledErrorError.class
        );
        assertThat(error).isNotNull();
        assertThat(error.condition()).isInstanceOf(OutputNamingErrorCondition.class);
        assertThat(error.condition().message()).contains("../escaped");
        assertThat(directory.resolve("escaped.json")).doesNotExist();
        assertThat(output.resolve("fine.json")).doesNotExist();
    }

    @Test
    void labelsDifferingOnlyInCaseAreFatal(@TempDir final Path directory) {
        final var sections = List.of(section("1", "Intro", "Intro"), section("2", "Also intro", "intro"));
        final var error = catchThrowableOfType(
            () -> emitter(LinkScheme.relative()).emit(sections, directory),
            UnhandledErrorError.class
        );
        assertThat(error).isNotNull();
        assertThat(error.condition()).isInstanceOf(OutputNamingErrorCondition.class);
        assertThat(error.condition().message()).contains("Sections 1 and 2");
        assertThat(directory.resolve("intro.json")).doesNotExist();
    }

    @Test
    void labelThatIsNoFileNameIsFatal(@TempDir final Path directory) {
        final var sections = List.of(section("1", "Nul", "a\0b"));
        final var error = catchThrowableOfType(
            () -> emitter(LinkScheme.relative()).emit(sections, directory),
            UnhandledErrorError.class
        );
        assertThat(error).isNotNull();
        assertThat(error.condition()).isInstanceOf(OutputNamingErrorCondition.class);
    }

    private static PageEmitter emitter(final LinkScheme linkScheme) {
        return new PageEmitter(markdown -> '<' + markdown + '>', linkScheme, NioFileOperations.instance());
    }

    private static Section section(final String identifier, final String title, final String label) {
        return new Section(identifier, title, label, label, List.of());
    }
}
