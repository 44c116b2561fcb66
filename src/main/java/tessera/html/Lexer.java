// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.html;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import tessera.dom.Attribute;
import tessera.dom.Attributes;
import tessera.dom.Elements;
import tessera.util.annotation.Nullable;
import tessera.util.condition.ConditionContext;

/**
 * The HTML lexer.
 * <p>
 * Turns a string into a lazy sequence of {@link Token}s that always ends with exactly one {@link Token.EndOfFile}.
 * Lexing never fails: malformed markup degrades into best-effort tokens, and each recovery signals a non-fatal
 * {@link HtmlParseErrorCondition}.
 * <p>
 * After a {@code <script>} or {@code <style>} start tag the lexer switches into raw text mode, where everything up to
 * the matching end tag is text, with no markup and no character references.
 */
public final class Lexer implements Iterator<Token> {
    /**
     * Initializes a new lexer over the given input.
     */
    public Lexer(final CharSequence input) {
        this.input = input.toString();
    }

    /**
     * Tokenizes the whole input eagerly.
     */
    public static List<Token> tokenize(final CharSequence input) {
        final var lexer = new Lexer(input);
        final var result = new ArrayList<Token>();
        lexer.forEachRemaining(result::add);
        return result;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("No more tokens left");
        }
        Token token;
        do {
            token = step();
        } while (token == null);
        if (token instanceof Token.EndOfFile) {
            finished = true;
        }
        return token;
    }

    // Runs one state, returning the token it produced, if any.
    private @Nullable Token step() {
        return switch (state) {
            case DATA -> data();
            case TAG_OPEN -> tagOpen();
            case TAG_NAME -> tagName();
            case ATTRIBUTE_NAME -> attributeName();
            case ATTRIBUTE_VALUE -> attributeValue();
            case RAWTEXT -> rawText();
            case COMMENT -> comment();
            case BOGUS -> bogus();
        };
    }

    private @Nullable Token data() {
        if (position >= input.length()) {
            return new Token.EndOfFile();
        }
        var end = position;
        while (end < input.length() && !startsMarkup(end)) {
            end += 1;
        }
        final var start = position;
        position = end;
        if (end < input.length()) {
            state = State.TAG_OPEN;
        }
        return (end > start) ? new Token.Text(Entities.decode(input.substring(start, end))) : null;
    }

    private boolean startsMarkup(final int index) {
        if (input.charAt(index) != '<' || index + 1 >= input.length()) {
            return false;
        }
        final var next = input.charAt(index + 1);
        return isAsciiAlpha(next) || next == '/' || next == '!' || next == '?';
    }

    private @Nullable Token tagOpen() {
        final var next = input.charAt(position + 1);
        if (next == '!') {
            if (input.startsWith("<!--", position)) {
                position += 4;
                state = State.COMMENT;
            } else {
                if (!input.regionMatches(true, position + 2, "doctype", 0, 7)) {
                    error("Unknown markup declaration dropped");
                }
                position += 2;
                state = State.BOGUS;
            }
        } else if (next == '?') {
            error("Processing instruction dropped");
            position += 2;
            state = State.BOGUS;
        } else if (next == '/') {
            final var afterSlash = charAt(position + 2);
            if (isAsciiAlpha(afterSlash)) {
                position += 2;
                beginTag(true);
            } else if (afterSlash == '>') {
                error("Empty end tag dropped");
                position += 3;
                state = State.DATA;
            } else {
                error("End tag with an invalid name dropped");
                position += 2;
                state = State.BOGUS;
            }
        } else {
            position += 1;
            beginTag(false);
        }
        return null;
    }

    private void beginTag(final boolean isEndTag) {
        tagIsEnd = isEndTag;
        tagSelfClosing = false;
        tagAttributes = new ArrayList<>();
        state = State.TAG_NAME;
    }

    private @Nullable Token tagName() {
        final var start = position;
        while (position < input.length() && !isTagNameTerminator(input.charAt(position))) {
            position += 1;
        }
        tagName = asciiLowercase(input.substring(start, position));
        state = State.ATTRIBUTE_NAME;
        return null;
    }

    private @Nullable Token attributeName() {
        skipWhitespace();
        if (position >= input.length()) {
            error("Unterminated tag '" + tagName + "' at end of input");
            return emitTag();
        }
        final var current = input.charAt(position);
        if (current == '>') {
            position += 1;
            return emitTag();
        }
        if (current == '/') {
            position += 1;
            if (charAt(position) == '>') {
                position += 1;
                tagSelfClosing = true;
                return emitTag();
            }
            return null;
        }
        final var start = position;
        // The first character always belongs to the name, even if it's '=', so that every step makes progress.
        position += 1;
        while (position < input.length() && !isAttributeNameTerminator(input.charAt(position))) {
            position += 1;
        }
        attributeName = asciiLowercase(input.substring(start, position));
        skipWhitespace();
        if (charAt(position) == '=') {
            position += 1;
            state = State.ATTRIBUTE_VALUE;
        } else {
            addAttribute("");
        }
        return null;
    }

    private @Nullable Token attributeValue() {
        skipWhitespace();
        state = State.ATTRIBUTE_NAME;
        if (position >= input.length()) {
            addAttribute("");
            return null;
        }
        final var quote = input.charAt(position);
        if (quote == '"' || quote == '\'') {
            final var close = input.indexOf(quote, position + 1);
            final String raw;
            if (close < 0) {
                error("Unterminated attribute value at end of input");
                raw = input.substring(position + 1);
                position = input.length();
            } else {
                raw = input.substring(position + 1, close);
                position = close + 1;
            }
            addAttribute(Entities.decode(raw));
            return null;
        }
        if (quote == '>') {
            error("Missing value of attribute '" + attributeName + "'");
            addAttribute("");
            return null;
        }
        final var start = position;
        while (position < input.length() && !isUnquotedValueTerminator(input.charAt(position))) {
            position += 1;
        }
        addAttribute(Entities.decode(input.substring(start, position)));
        return null;
    }

    private void addAttribute(final String value) {
        for (final var attribute : tagAttributes) {
            if (attribute.name().equals(attributeName)) {
                error("Duplicate attribute '" + attributeName + "' ignored");
                return;
            }
        }
        tagAttributes.add(new Attribute(attributeName, value));
    }

    private Token emitTag() {
        state = State.DATA;
        if (tagIsEnd) {
            if (!tagAttributes.isEmpty()) {
                error("Attributes of end tag '" + tagName + "' discarded");
            }
            return new Token.EndTag(tagName);
        }
        if (Elements.isRawText(tagName) && !tagSelfClosing) {
            state = State.RAWTEXT;
            rawTextTagName = tagName;
        }
        return new Token.StartTag(tagName, Attributes.of(tagAttributes), tagSelfClosing);
    }

    private @Nullable Token rawText() {
        state = State.DATA;
        final var start = position;
        var end = findRawTextEnd();
        if (end < 0) {
            error("Unterminated '" + rawTextTagName + "' element at end of input");
            end = input.length();
        }
        position = end;
        return (end > start) ? new Token.Text(input.substring(start, end)) : null;
    }

    private int findRawTextEnd() {
        final var nameLength = rawTextTagName.length();
        for (var index = input.indexOf("</", position); index >= 0; index = input.indexOf("</", index + 1)) {
            if (input.regionMatches(true, index + 2, rawTextTagName, 0, nameLength)) {
                final var after = charAt(index + 2 + nameLength);
                if (after == endOfInput || isTagNameTerminator(after)) {
                    return index;
                }
            }
        }
        return -1;
    }

    private @Nullable Token comment() {
        state = State.DATA;
        // "<!-->" and "<!--->" are empty comments.
        if (input.startsWith(">", position)) {
            position += 1;
            return new Token.Comment("");
        }
        if (input.startsWith("->", position)) {
            position += 2;
            return new Token.Comment("");
        }
        final var end = input.indexOf("-->", position);
        final String content;
        if (end < 0) {
            error("Unterminated comment at end of input");
            content = input.substring(position);
            position = input.length();
        } else {
            content = input.substring(position, end);
            position = end + 3;
        }
        return new Token.Comment(content);
    }

    private @Nullable Token bogus() {
        state = State.DATA;
        final var end = input.indexOf('>', position);
        position = (end < 0) ? input.length() : end + 1;
        return null;
    }

    private void skipWhitespace() {
        while (position < input.length() && isWhitespace(input.charAt(position))) {
            position += 1;
        }
    }

    private char charAt(final int index) {
        return (index < input.length()) ? input.charAt(index) : endOfInput;
    }

    private void error(final String message) {
        ConditionContext.signal(new HtmlParseErrorCondition(message, position));
    }

    private static boolean isTagNameTerminator(final char c) {
        return isWhitespace(c) || c == '/' || c == '>';
    }

    private static boolean isAttributeNameTerminator(final char c) {
        return isTagNameTerminator(c) || c == '=';
    }

    private static boolean isUnquotedValueTerminator(final char c) {
        return isWhitespace(c) || c == '>';
    }

    static boolean isWhitespace(final char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '\r';
    }

    private static boolean isAsciiAlpha(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static String asciiLowercase(final String string) {
        final var chars = string.toCharArray();
        for (int i = 0; i < chars.length; i += 1) {
            if (chars[i] >= 'A' && chars[i] <= 'Z') {
                chars[i] += 'a' - 'A';
            }
        }
        return new String(chars);
    }

    private final String input;
    private int position = 0;
    private State state = State.DATA;
    private boolean finished = false;

    // The tag being lexed.
    private boolean tagIsEnd = false;
    private boolean tagSelfClosing = false;
    private String tagName = "";
    private ArrayList<Attribute> tagAttributes = new ArrayList<>();
    private String attributeName = "";

    private String rawTextTagName = "";

    private static final char endOfInput = '\uFFFF';

    private enum State {
        DATA,
        TAG_OPEN,
        TAG_NAME,
        ATTRIBUTE_NAME,
        ATTRIBUTE_VALUE,
        RAWTEXT,
        COMMENT,
        BOGUS,
    }
}
