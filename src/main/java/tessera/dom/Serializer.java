// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.dom;

import java.io.IOException;
import java.io.Writer;
import tessera.util.UnreachableCodeReachedError;
import tessera.util.annotation.Nullable;

/**
 * The document-to-HTML serializer.
 * <p>
 * Output is normalized markup: every non-void element gets an explicit end tag, so serializing a parsed document shows
 * exactly which elements were closed implicitly.
 */
public final class Serializer {
    private Serializer(final Writer writer, final Document document) {
        this.writer = writer;
        this.document = document;
    }

    /**
     * Serializes the given document to HTML, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(final Writer writer, final Document document) throws IOException {
        new Serializer(writer, document).serializeTree();
    }

    // Walks the sibling and parent links, so arbitrarily deep trees don't need a deep stack.
    private void serializeTree() throws IOException {
        var current = document.firstChild(Document.ROOT);
        while (current != Document.NONE) {
            final var hasEndTag = openNode(current);
            if (hasEndTag && document.firstChild(current) != Document.NONE) {
                current = document.firstChild(current);
                continue;
            }
            if (hasEndTag) {
                closeElement(current);
            }
            while (document.nextSibling(current) == Document.NONE) {
                current = document.parent(current);
                if (current == Document.ROOT) {
                    return;
                }
                closeElement(current);
            }
            current = document.nextSibling(current);
        }
    }

    // Writes the node, or the start tag of an element, returning whether an end tag is needed.
    private boolean openNode(final int id) throws IOException {
        final var node = document.node(id);
        if (node instanceof Node.Text text) {
            if (isInRawTextElement(id)) {
                writer.write(text.content());
            } else {
                serializeString(text.content(), false);
            }
            return false;
        } else if (node instanceof Node.Comment comment) {
            writer.write("<!--");
            writer.write(comment.content());
            writer.write("-->");
            return false;
        } else if (node instanceof Node.Element element) {
            writer.write('<');
            writer.write(element.tagName());
            for (final var attribute : element.attributes()) {
                writer.write(' ');
                writer.write(attribute.name());
                writer.write("=\"");
                serializeString(attribute.value(), true);
                writer.write('"');
            }
            writer.write('>');
            return !Elements.isVoid(element.tagName());
        }
        throw new UnreachableCodeReachedError("Root node found below the root: " + id);
    }

    private void closeElement(final int id) throws IOException {
        writer.write("</");
        writer.write(document.element(id).tagName());
        writer.write('>');
    }

    private boolean isInRawTextElement(final int id) {
        final var parent = document.parent(id);
        return document.isElement(parent) && Elements.isRawText(document.element(parent).tagName());
    }

    private void serializeString(final String string, final boolean inAttribute) throws IOException {
        int index = 0;
        final var length = string.length();
        for (int i = 0; i < length; i += 1) {
            final var replacement = escape(string.charAt(i), inAttribute);
            if (replacement != null) {
                writer.write(string, index, i - index);
                writer.write(replacement);
                index = i + 1;
            }
        }
        writer.write(string, index, length - index);
    }

    private static @Nullable String escape(final char character, final boolean inAttribute) {
        return switch (character) {
            case '<' -> "&lt;";
            case '>' -> "&gt;";
            case '&' -> "&amp;";
            case '\u00A0' -> "&nbsp;";
            case '"' -> inAttribute ? "&quot;" : null;
            default -> null;
        };
    }

    private final Writer writer;
    private final Document document;
}
