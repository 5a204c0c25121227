// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import bookbinder.util.annotation.Nullable;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The published record of one section, as served to readers.
 *
 * @param id        The section identifier.
 * @param title     The section title.
 * @param content   The rendered HTML content.
 * @param prev      The url of the previous page, or {@code null} on the first page.
 * @param prevTitle The title of the previous page, or {@code null} on the first page.
 * @param next      The url of the next page, or {@code null} on the last page.
 * @param nextTitle The title of the next page, or {@code null} on the last page.
 */
@JsonPropertyOrder({"id", "title", "content", "prev", "prevTitle", "next", "nextTitle"})
public record Page(
    String id,
    String title,
    String content,
    @Nullable String prev,
    @Nullable String prevTitle,
    @Nullable String next,
    @Nullable String nextTitle
) {
}
