// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

import java.util.List;

/**
 * Everything the parser hands over to the publishing pipeline.
 *
 * @param roots       The top-level sections, in document order.
 * @param labels      The cross-reference targets.
 * @param definitions The glossary definitions.
 */
public record ParsedDocument(List<Section> roots, LabelTable labels, DefinitionTable definitions) {
    public ParsedDocument {
        roots = List.copyOf(roots);
    }
}
