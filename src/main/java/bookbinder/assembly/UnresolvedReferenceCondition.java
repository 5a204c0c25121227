// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import bookbinder.util.condition.Condition;

/**
 * A non-fatal condition indicating that a cross-reference marker names an id missing from the label table. The id
 * text is kept in place of the marker.
 */
public final class UnresolvedReferenceCondition extends Condition {
    UnresolvedReferenceCondition(final String referenceId) {
        super("Unresolved cross-reference: " + referenceId);
        this.referenceId = referenceId;
    }

    public String referenceId() {
        return referenceId;
    }

    private final String referenceId;
}
