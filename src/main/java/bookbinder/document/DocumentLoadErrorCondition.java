// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

import java.nio.file.Path;
import bookbinder.util.condition.ExceptionCondition;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * A condition type indicating that the input document isn't valid JSON of the expected shape.
 */
public final class DocumentLoadErrorCondition extends ExceptionCondition<JsonProcessingException> {
    DocumentLoadErrorCondition(final Path path, final JsonProcessingException exception) {
        super("Cannot load document " + path + ": " + exception.getOriginalMessage(), exception);
        this.path = path;
    }

    /**
     * Retrieves the path of the offending document.
     */
    public Path path() {
        return path;
    }

    private final Path path;
}
