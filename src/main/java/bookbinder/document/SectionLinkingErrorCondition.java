// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

import bookbinder.util.condition.Condition;

/**
 * A condition type indicating that a document was read successfully, but its sections or labels are inconsistent:
 * a missing identifier, a duplicate identifier or label, or a label pointing at a section that doesn't exist.
 */
public final class SectionLinkingErrorCondition extends Condition {
    SectionLinkingErrorCondition(final String message) {
        super(message);
    }
}
