// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The parsed document: the section tree, its labels and its definitions, and the loader reading them from JSON.
 */
@NonNullByDefault
package bookbinder.document;

import bookbinder.util.annotation.NonNullByDefault;
