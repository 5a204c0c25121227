// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import bookbinder.util.annotation.Nullable;

/**
 * The read-only mapping from definition names to their raw, unresolved text.
 */
public final class DefinitionTable {
    private DefinitionTable(final Map<String, String> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    /**
     * Returns a table containing the given definitions.
     */
    public static DefinitionTable of(final Map<String, String> definitions) {
        return new DefinitionTable(definitions);
    }

    /**
     * Returns a table with no definitions.
     */
    public static DefinitionTable empty() {
        return emptyTable;
    }

    public @Nullable String get(final String name) {
        return definitions.get(name);
    }

    /**
     * Returns all definitions, in insertion order.
     */
    public Map<String, String> asMap() {
        return definitions;
    }

    private static final DefinitionTable emptyTable = new DefinitionTable(Map.of());

    private final Map<String, String> definitions;
}
