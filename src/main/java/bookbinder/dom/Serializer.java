// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.dom;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import bookbinder.util.UnreachableCodeReachedError;
import bookbinder.util.annotation.Nullable;

/**
 * The DOM-to-HTML serializer.
 * <p>
 * Output is compact: no whitespace is inserted between elements, so equal trees always serialize to equal strings.
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the tree rooted at {@code rootNode}, writing HTML to the given {@link Writer}.
     * <p>
     * {@link IOException}s thrown by the writer propagate.
     */
    public static void serialize(final Writer writer, final Node rootNode) throws IOException {
        new Serializer(writer).serializeNode(rootNode);
    }

    /**
     * Serializes the tree rooted at {@code rootNode} to a string.
     */
    public static String serializeToString(final Node rootNode) {
        final var writer = new StringWriter();
        try {
            serialize(writer, rootNode);
        } catch (final IOException e) {
            // StringWriter doesn't do I/O.
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private void serializeNode(final Node node) throws IOException {
        if (node instanceof final Node.Text text) {
            serializeString(text.text(), TextEscaper.instance);
        } else if (node instanceof final Node.Element element) {
            serializeElement(element);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeElement(final Node.Element element) throws IOException {
        final var name = element.tag().htmlName();
        writer.write('<');
        writer.write(name);
        serializeAttributes(element.attributes());
        writer.write('>');
        for (final var child : element.children()) {
            serializeNode(child);
        }
        writer.write("</");
        writer.write(name);
        writer.write('>');
    }

    private void serializeAttributes(final List<Attribute> attributes) throws IOException {
        for (final var attribute : attributes) {
            writer.write(' ');
            writer.write(attribute.name());
            writer.write("=\"");
            serializeString(attribute.value(), AttributeEscaper.instance);
            writer.write('"');
        }
    }

    private void serializeString(final String string, final Escaper escaper) throws IOException {
        int index = 0;
        final var length = string.length();
        for (int i = 0; i < length; i += 1) {
            final var replacement = escaper.escape(string.charAt(i));
            if (replacement != null) {
                writer.write(string, index, i - index);
                writer.write(replacement);
                index = i + 1;
            }
        }
        writer.write(string, index, length - index);
    }

    private final Writer writer;

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '"') ? "&quot;" : TextEscaper.instance.escape(character);
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
