// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities used throughout the pipeline.
 */
@NonNullByDefault
package bookbinder.util;

import bookbinder.util.annotation.NonNullByDefault;
