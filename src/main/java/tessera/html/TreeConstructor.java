// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.html;

import java.util.ArrayDeque;
import java.util.Iterator;
import tessera.dom.Document;
import tessera.dom.DocumentBuilder;
import tessera.util.UnreachableCodeReachedError;
import tessera.util.condition.ConditionContext;

/**
 * The HTML tree constructor.
 * <p>
 * Consumes a token sequence and builds a {@link Document}, keeping an explicit stack of open elements. Before a start
 * tag is pushed, the implicit-close rules are applied against the top of the stack:
 * <ul>
 *     <li>{@code p}, {@code table}, {@code form} and headings close an open {@code p};</li>
 *     <li>{@code li} closes an open {@code li};</li>
 *     <li>{@code dt} and {@code dd} close an open {@code dt} or {@code dd};</li>
 *     <li>{@code tr} closes an open {@code tr}, or an open cell together with its row;</li>
 *     <li>{@code td} and {@code th} close an open cell.</li>
 * </ul>
 * An end tag closes the nearest open element with the same name and everything opened after it. An end tag with no
 * matching open element is dropped, signaling an {@link HtmlParseErrorCondition}.
 */
public final class TreeConstructor {
    private TreeConstructor(final long generation) {
        builder = new DocumentBuilder(generation);
    }

    /**
     * Parses the given markup into a document of generation zero.
     */
    public static Document parse(final CharSequence input) {
        return parse(input, 0);
    }

    /**
     * Parses the given markup into a document of the given generation.
     */
    public static Document parse(final CharSequence input, final long generation) {
        return build(new Lexer(input), generation);
    }

    /**
     * Builds a document from the given tokens, consuming them up to and including the first
     * {@link Token.EndOfFile}.
     */
    public static Document build(final Iterator<Token> tokens, final long generation) {
        final var constructor = new TreeConstructor(generation);
        while (tokens.hasNext()) {
            final var token = tokens.next();
            if (token instanceof Token.EndOfFile) {
                break;
            }
            constructor.process(token);
        }
        // Whatever is still open is simply left where it is.
        return constructor.builder.build();
    }

    private void process(final Token token) {
        if (token instanceof Token.StartTag startTag) {
            processStartTag(startTag);
        } else if (token instanceof Token.EndTag endTag) {
            processEndTag(endTag);
        } else if (token instanceof Token.Text text) {
            builder.appendText(insertionPoint(), text.content());
        } else if (token instanceof Token.Comment comment) {
            builder.appendComment(insertionPoint(), comment.content());
        } else {
            throw new UnreachableCodeReachedError("Unexpected token: " + token);
        }
    }

    private void processStartTag(final Token.StartTag tag) {
        final var category = TagCategory.of(tag.name());
        closeImplicitly(category);
        final var id = builder.appendElement(insertionPoint(), tag.name(), tag.attributes());
        if (category == TagCategory.VOID) {
            return;
        }
        if (tag.selfClosing()) {
            error("Self-closing flag on non-void element '" + tag.name() + "' ignored");
        }
        openElements.push(new OpenElement(id, tag.name(), category));
    }

    private void closeImplicitly(final TagCategory category) {
        final var top = openElements.peek();
        if (top == null) {
            return;
        }
        if (category.closes(top.category())) {
            openElements.pop();
        } else if (category == TagCategory.TABLE_ROW && top.category().isTableCell()) {
            final var iterator = openElements.iterator();
            iterator.next();
            if (iterator.hasNext() && iterator.next().category() == TagCategory.TABLE_ROW) {
                openElements.pop();
                openElements.pop();
            }
        }
    }

    private void processEndTag(final Token.EndTag tag) {
        var depth = 0;
        for (final var element : openElements) {
            depth += 1;
            if (element.tagName().equals(tag.name())) {
                for (int i = 0; i < depth; i += 1) {
                    openElements.pop();
                }
                return;
            }
        }
        error("End tag '" + tag.name() + "' without a matching open element dropped");
    }

    private static void error(final String message) {
        ConditionContext.signal(new HtmlParseErrorCondition(message));
    }

    private int insertionPoint() {
        final var top = openElements.peek();
        return (top == null) ? Document.ROOT : top.id();
    }

    private final DocumentBuilder builder;
    // Top of the stack first; the document root is implicitly below the bottom.
    private final ArrayDeque<OpenElement> openElements = new ArrayDeque<>();

    private record OpenElement(int id, String tagName, TagCategory category) {
    }
}
