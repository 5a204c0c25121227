// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import java.util.List;
import bookbinder.document.Section;

/**
 * The result of flattening a section tree.
 *
 * @param sections   The sections to emit pages for, in pre-order.
 * @param navigation The navigation forest mirroring the same sections.
 */
public record FlattenedDocument(List<Section> sections, List<NavItem> navigation) {
    public FlattenedDocument {
        sections = List.copyOf(sections);
        navigation = List.copyOf(navigation);
    }
}
