// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The file operations the pipeline performs, each on an explicitly given path.
 */
@NonNullByDefault
package bookbinder.io;

import bookbinder.util.annotation.NonNullByDefault;
