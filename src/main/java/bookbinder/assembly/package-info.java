// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Turning the parsed section tree into the flat page sequence and navigation tree, resolving cross-references on
 * the way.
 */
@NonNullByDefault
package bookbinder.assembly;

import bookbinder.util.annotation.NonNullByDefault;
