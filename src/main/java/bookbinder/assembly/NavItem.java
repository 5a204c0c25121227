// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import java.util.List;
import bookbinder.dom.Node;

/**
 * An entry of the navigation tree.
 */
public sealed interface NavItem {
    /**
     * Retrieves the link to the section this entry stands for.
     */
    Node.Element link();

    /**
     * An entry for a section without subsections.
     */
    record Leaf(Node.Element link) implements NavItem {
    }

    /**
     * An entry for a section with subsections. The children are those that survived filtering, so the list may be
     * empty.
     */
    record Branch(Node.Element link, List<NavItem> children) implements NavItem {
        public Branch {
            children = List.copyOf(children);
        }
    }
}
