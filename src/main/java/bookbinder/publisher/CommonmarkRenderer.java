// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import bookbinder.util.condition.ConditionContext;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

/**
 * The CommonMark {@link MarkdownRenderer}.
 * <p>
 * Trailing whitespace is stripped from the output so that rendered blocks can be joined predictably.
 */
public final class CommonmarkRenderer implements MarkdownRenderer {
    /**
     * Initializes a new renderer with the default CommonMark options.
     */
    public CommonmarkRenderer() {
        parser = Parser.builder().build();
        htmlRenderer = HtmlRenderer.builder().build();
    }

    @Override
    public String render(final String markdown) {
        try {
            return htmlRenderer.render(parser.parse(markdown)).stripTrailing();
        } catch (final RuntimeException e) {
            throw ConditionContext.error(new RenderErrorCondition("markdown", e));
        }
    }

    private final Parser parser;
    private final HtmlRenderer htmlRenderer;
}
