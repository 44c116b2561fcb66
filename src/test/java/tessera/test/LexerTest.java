// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import tessera.dom.Attribute;
import tessera.dom.Attributes;
import tessera.html.HtmlParseErrorCondition;
import tessera.html.Lexer;
import tessera.html.Token;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class LexerTest {
    @Test
    void tokenizesTagsTextAndAttributes() {
        final var tokens = Lexer.tokenize("<P Class=\"a b\" id=x>Hi</p>");
        assertThat(tokens).containsExactly(
            new Token.StartTag("p", attributes("class", "a b", "id", "x"), false),
            new Token.Text("Hi"),
            new Token.EndTag("p"),
            new Token.EndOfFile()
        );
    }

    @Test
    void endsWithExactlyOneEndOfFile() {
        assertThat(Lexer.tokenize("")).containsExactly(new Token.EndOfFile());
        final var tokens = Lexer.tokenize("text <b>bold");
        assertThat(tokens).last().isEqualTo(new Token.EndOfFile());
        assertThat(tokens).filteredOn(Token.EndOfFile.class::isInstance).hasSize(1);
    }

    @Test
    void decodesEntitiesInTextAndAttributes() {
        final var tokens = Lexer.tokenize("<a title='&lt;&#65;&#x42;&gt;'>&amp;&copy;&bogus;</a>");
        assertThat(tokens).startsWith(
            new Token.StartTag("a", attributes("title", "<AB>"), false),
            new Token.Text("&©&bogus;")
        );
    }

    @Test
    void invalidNumericReferenceBecomesReplacementCharacter() {
        assertThat(Lexer.tokenize("&#0;&#x110000;")).first().isEqualTo(new Token.Text("\uFFFD\uFFFD"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"script", "style", "SCRIPT", "Style"})
    void rawTextIgnoresMarkupUntilMatchingEndTag(final String name) {
        final var tokens = Lexer.tokenize("<" + name + ">if (a < b && c > d) { x = '</p>'; }</" + name + "><p>");
        final var lowercase = name.toLowerCase(Locale.ROOT);
        assertThat(tokens).containsExactly(
            new Token.StartTag(lowercase, Attributes.empty(), false),
            new Token.Text("if (a < b && c > d) { x = '</p>'; }"),
            new Token.EndTag(lowercase),
            new Token.StartTag("p", Attributes.empty(), false),
            new Token.EndOfFile()
        );
    }

    @Test
    void rawTextDoesNotDecodeEntities() {
        assertThat(Lexer.tokenize("<style>a::after { content: '&amp;' }</style>"))
            .contains(new Token.Text("a::after { content: '&amp;' }"));
    }

    @Test
    void endTagAttributesAreDiscarded() {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(Lexer.tokenize("</div class=\"x\">")).containsExactly(
                new Token.EndTag("div"),
                new Token.EndOfFile()
            );
            assertThat(recorder.ofType(HtmlParseErrorCondition.class)).hasSize(1);
        }
    }

    @Test
    void selfClosingSlashIsRecorded() {
        assertThat(Lexer.tokenize("<br/><div />")).containsExactly(
            new Token.StartTag("br", Attributes.empty(), true),
            new Token.StartTag("div", Attributes.empty(), true),
            new Token.EndOfFile()
        );
    }

    @Test
    void duplicateAttributesKeepTheFirstValue() {
        try (final var recorder = new ConditionRecorder()) {
            final var tokens = Lexer.tokenize("<p id=a ID=b>");
            assertThat(tokens).first().isEqualTo(new Token.StartTag("p", attributes("id", "a"), false));
            assertThat(recorder.ofType(HtmlParseErrorCondition.class)).hasSize(1);
        }
    }

    @Test
    void commentsAndDeclarations() {
        final var tokens = Lexer.tokenize("<!DOCTYPE html><!-- note --><?xml version?>x");
        assertThat(tokens).containsExactly(
            new Token.Comment(" note "),
            new Token.Text("x"),
            new Token.EndOfFile()
        );
    }

    @Test
    void lessThanSignNotStartingMarkupIsText() {
        assertThat(Lexer.tokenize("1 < 2 <3")).containsExactly(new Token.Text("1 < 2 <3"), new Token.EndOfFile());
    }

    @Test
    void unterminatedInputDegradesGracefully() {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(Lexer.tokenize("<div class=\"open")).containsExactly(
                new Token.StartTag("div", attributes("class", "open"), false),
                new Token.EndOfFile()
            );
            assertThat(Lexer.tokenize("<!-- never closed")).containsExactly(
                new Token.Comment(" never closed"),
                new Token.EndOfFile()
            );
            assertThat(recorder.ofType(HtmlParseErrorCondition.class)).isNotEmpty();
        }
    }

    private static Attributes attributes(final String... namesAndValues) {
        final var list = new ArrayList<Attribute>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            list.add(new Attribute(namesAndValues[i], namesAndValues[i + 1]));
        }
        return Attributes.of(List.copyOf(list));
    }
}
