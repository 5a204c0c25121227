// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The {@code bookbinder} command: publishes one input document to one output directory, reporting diagnostics on
 * standard error.
 */
@NonNullByDefault
package bookbinder.cli;

import bookbinder.util.annotation.NonNullByDefault;
