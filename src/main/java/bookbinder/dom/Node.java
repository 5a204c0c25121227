// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.dom;

import java.util.List;

/**
 * The base interface for DOM tree nodes. Nodes are immutable.
 */
public sealed interface Node {
    /**
     * Returns a new element with the given children and no attributes.
     */
    static Element simple(final Tag tag, final List<? extends Node> children) {
        return new Element(tag, List.of(), List.copyOf(children));
    }

    /**
     * Returns a new element with a single child and no attributes.
     */
    static Element simple(final Tag tag, final Node child) {
        return new Element(tag, List.of(), List.of(child));
    }

    /**
     * Returns a new {@code <a>} element pointing at {@code href} with the given link text.
     */
    static Element anchor(final String href, final String text) {
        return new Element(Tag.A, List.of(new Attribute("href", href)), List.of(new Text(text)));
    }

    /**
     * Bare text, escaped on serialization.
     */
    record Text(String text) implements Node {
    }

    /**
     * An HTML element with attributes and children, both kept in insertion order.
     */
    record Element(Tag tag, List<Attribute> attributes, List<Node> children) implements Node {
        public Element {
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }
    }
}
