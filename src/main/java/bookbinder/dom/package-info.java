// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A minimal immutable HTML DOM and its serializer, used for the markup the pipeline generates itself.
 */
@NonNullByDefault
package bookbinder.dom;

import bookbinder.util.annotation.NonNullByDefault;
