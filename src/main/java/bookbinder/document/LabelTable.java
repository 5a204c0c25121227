// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import bookbinder.util.annotation.Nullable;

/**
 * The read-only mapping from cross-reference ids to {@link Label}s.
 */
public final class LabelTable {
    private LabelTable(final Map<String, Label> labels) {
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Returns a table containing the given mappings.
     */
    public static LabelTable of(final Map<String, ? extends Label> labels) {
        return new LabelTable(new LinkedHashMap<String, Label>(labels));
    }

    /**
     * Returns a table with no labels at all.
     */
    public static LabelTable empty() {
        return emptyTable;
    }

    /**
     * Looks up the label with the given id, returning {@code null} if there's none.
     */
    public @Nullable Label get(final String referenceId) {
        return labels.get(referenceId);
    }

    /**
     * Returns all mappings, in insertion order.
     */
    public Map<String, Label> asMap() {
        return labels;
    }

    private static final LabelTable emptyTable = new LabelTable(Map.of());

    private final Map<String, Label> labels;
}
