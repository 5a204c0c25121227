// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Rendering the flattened document into page records, the glossary and the navigation index, and publishing them
 * in one swap.
 */
@NonNullByDefault
package bookbinder.publisher;

import bookbinder.util.annotation.NonNullByDefault;
