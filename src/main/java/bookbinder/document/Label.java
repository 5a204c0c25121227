// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

/**
 * The target of a cross-reference id.
 */
public sealed interface Label {
    /**
     * A reference to another section of the document.
     */
    record SectionRef(Section section) implements Label {
    }

    /**
     * A reference to a glossary entry, by definition name.
     */
    record DefinitionRef(String name) implements Label {
    }

    /**
     * A numbered item with no page of its own, like an equation or a figure; referencing it yields the number.
     */
    record ItemRef(String ordinal) implements Label {
    }
}
