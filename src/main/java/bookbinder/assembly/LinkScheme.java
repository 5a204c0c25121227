// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import java.util.Locale;
import bookbinder.document.Section;
import bookbinder.dom.Node;
import bookbinder.util.annotation.Nullable;

/**
 * How sections and definitions map to urls, anchors and file names.
 * <p>
 * A section labeled {@code Intro} lives at {@code {linkBase}intro.html}; its page record is stored as
 * {@code intro.json}. The definition {@code Big Deal} lives at {@code {linkBase}dictionary.html#big-deal}.
 */
public final class LinkScheme {
    /**
     * Initializes a scheme prefixing every generated url with the given link base.
     */
    public LinkScheme(final String linkBase) {
        this.linkBase = linkBase;
    }

    /**
     * Returns the scheme producing relative links.
     */
    public static LinkScheme relative() {
        return relativeScheme;
    }

    /**
     * Returns the url of the given section, or {@code null} if the section has no label to derive one from.
     */
    public @Nullable String sectionUrl(final Section section) {
        final var stem = pageStem(section);
        return (stem == null) ? null : linkBase + stem + '.' + htmlExtension;
    }

    /**
     * Returns the url of the glossary entry with the given name.
     */
    public String definitionUrl(final String definitionName) {
        return linkBase + dictionaryFileName + '#' + anchor(definitionName);
    }

    /**
     * Returns the DOM link to the given labeled section, using its title as the link text.
     */
    public Node.Element sectionAnchor(final Section section) {
        final var url = sectionUrl(section);
        if (url == null) {
            throw new IllegalArgumentException("Section " + section.identifier() + " has no label");
        }
        return Node.anchor(url, section.title());
    }

    /**
     * Returns the file name stem shared by the section's url and its page record, or {@code null} if the section has
     * no label.
     */
    public static @Nullable String pageStem(final Section section) {
        final var label = section.label();
        return (label == null) ? null : label.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the fragment identifier of the glossary entry with the given name.
     */
    public static String anchor(final String definitionName) {
        return definitionName.toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    /**
     * Returns an inline markdown link.
     */
    public static String markdownLink(final String text, final String url) {
        return '[' + text + "](" + url + ')';
    }

    public static final String dictionaryFileName = "dictionary.html";
    public static final String navigationFileName = "navigation.html";
    private static final String htmlExtension = "html";
    private static final LinkScheme relativeScheme = new LinkScheme("");

    private final String linkBase;
}
