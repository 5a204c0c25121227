// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.dom;

/**
 * A string-valued attribute of a DOM element.
 *
 * @param name  The attribute name, written as is.
 * @param value The attribute value, escaped on serialization.
 */
public record Attribute(String name, String value) {
}
