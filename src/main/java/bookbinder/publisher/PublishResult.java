// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import java.nio.file.Path;
import java.util.List;

/**
 * The outcome of a publishing run.
 */
public sealed interface PublishResult {
    /**
     * The run succeeded and the target now holds the new output.
     *
     * @param target    The directory the output was published to.
     * @param pageCount The number of page records published.
     */
    record Published(Path target, int pageCount) implements PublishResult {
    }

    /**
     * The run was aborted; a previously published target is left as it was.
     *
     * @param message        What went wrong, naming the offending path where there is one.
     * @param operationTrace The operations in progress when it went wrong, innermost first.
     */
    record Failed(String message, List<String> operationTrace) implements PublishResult {
        public Failed {
            operationTrace = List.copyOf(operationTrace);
        }
    }
}
