// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

import java.util.List;
import bookbinder.util.annotation.Nullable;

/**
 * A titled section of a document, owning its subsections.
 * <p>
 * Everything but the content is fixed at construction. The content starts out as the raw text coming from the
 * parser, and is replaced with its normalized form when the section is visited during flattening.
 */
public final class Section {
    /**
     * Initializes a new section.
     *
     * @param identifier The document-unique identifier of the section, such as {@code 2.1}.
     * @param title      The human-readable title, used as link text.
     * @param content    The raw content, possibly containing cross-reference markers.
     * @param label      The label the section is reachable by, or {@code null} if it has none.
     * @param children   The subsections, in document order.
     */
    public Section(
        final String identifier,
        final String title,
        final String content,
        final @Nullable String label,
        final List<Section> children
    ) {
        this.identifier = identifier;
        this.title = title;
        this.content = content;
        this.label = label;
        this.children = List.copyOf(children);
    }

    public String identifier() {
        return identifier;
    }

    public String title() {
        return title;
    }

    /**
     * Retrieves the current content: raw before flattening, normalized after.
     */
    public String content() {
        return content;
    }

    /**
     * Replaces the content. Used by the tree walker to store the normalized text.
     */
    public void replaceContent(final String newContent) {
        content = newContent;
    }

    public @Nullable String label() {
        return label;
    }

    public List<Section> children() {
        return children;
    }

    /**
     * Counts all sections below this one, at any depth.
     */
    public int descendantCount() {
        int count = 0;
        for (final var child : children) {
            count += 1 + child.descendantCount();
        }
        return count;
    }

    @Override
    public String toString() {
        return "Section[" + identifier + ", " + title + ']';
    }

    private final String identifier;
    private final String title;
    private String content;
    private final @Nullable String label;
    private final List<Section> children;
}
