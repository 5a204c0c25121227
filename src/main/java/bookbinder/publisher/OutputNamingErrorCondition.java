// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import bookbinder.util.condition.Condition;

/**
 * A condition type indicating that names derived from the document can't all be used for output: a section label
 * that isn't a plain file name, two sections whose pages would share a file, or two definitions whose glossary
 * entries would share an anchor.
 */
public final class OutputNamingErrorCondition extends Condition {
    OutputNamingErrorCondition(final String message) {
        super(message);
    }
}
