// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.test;

import bookbinder.publisher.CommonmarkRenderer;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class CommonmarkRendererTest {
    @Test
    void paragraphsAndLinksRender() {
        assertThat(renderer.render("See [foo](dictionary.html#foo).\n\nSecond *paragraph*."))
            .isEqualTo("<p>See <a href=\"dictionary.html#foo\">foo</a>.</p>\n<p>Second <em>paragraph</em>.</p>");
    }

    @Test
    void emptyInputRendersEmpty() {
        assertThat(renderer.render("")).isEmpty();
    }

    @Test
    void outputHasNoTrailingWhitespace() {
        assertThat(renderer.render("text\n\n\n")).isEqualTo("<p>text</p>");
    }

    private final CommonmarkRenderer renderer = new CommonmarkRenderer();
}
