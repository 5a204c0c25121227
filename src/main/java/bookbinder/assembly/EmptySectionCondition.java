// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import bookbinder.document.Section;
import bookbinder.util.condition.Condition;

/**
 * A non-fatal condition indicating that a section has neither content nor subsections and was left out.
 */
public final class EmptySectionCondition extends Condition {
    EmptySectionCondition(final Section section) {
        super("Section " + section.identifier() + " (" + section.title() + ") is empty, skipping it");
        sectionIdentifier = section.identifier();
    }

    public String sectionIdentifier() {
        return sectionIdentifier;
    }

    private final String sectionIdentifier;
}
