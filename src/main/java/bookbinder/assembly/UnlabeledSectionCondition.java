// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import bookbinder.document.Section;
import bookbinder.util.condition.Condition;

/**
 * A non-fatal condition indicating that a section has no label, so neither it nor any of its subsections get a page
 * or a navigation entry.
 */
public final class UnlabeledSectionCondition extends Condition {
    UnlabeledSectionCondition(final Section section) {
        super(
            "Section " + section.identifier() + " (" + section.title() + ") has no label, skipping it along with "
                + section.descendantCount() + " subsection(s)"
        );
        sectionIdentifier = section.identifier();
    }

    public String sectionIdentifier() {
        return sectionIdentifier;
    }

    private final String sectionIdentifier;
}
