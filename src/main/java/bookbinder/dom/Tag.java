// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.dom;

import java.util.Locale;

/**
 * HTML elements the pipeline emits.
 * <p>
 * Page bodies come out of the markdown renderer; only the navigation list and the glossary
 * headings are built as DOM trees.
 */
public enum Tag {
    A,
    H2,
    LI,
    UL;

    Tag() {
        htmlName = name().toLowerCase(Locale.ROOT);
    }

    /**
     * Retrieves the element name as written in HTML.
     */
    public String htmlName() {
        return htmlName;
    }

    private final String htmlName;
}
