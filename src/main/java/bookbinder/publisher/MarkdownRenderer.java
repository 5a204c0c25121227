// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

/**
 * Converts resolved markdown text into HTML.
 * <p>
 * Implementations signal {@link RenderErrorCondition} as a fatal condition if the text can't be rendered.
 */
@FunctionalInterface
public interface MarkdownRenderer {
    String render(String markdown);
}
