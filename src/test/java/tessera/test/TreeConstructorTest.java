// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import tessera.dom.Document;
import tessera.dom.Node;
import tessera.dom.Serializer;
import tessera.html.HtmlParseErrorCondition;
import tessera.html.TreeConstructor;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class TreeConstructorTest {
    @Test
    void listItemsCloseEachOther() {
        final var document = TreeConstructor.parse("<ul><li>a<li>b</ul>");
        assertThat(serialize(document)).isEqualTo("<ul><li>a</li><li>b</li></ul>");
        final var list = document.elementsByTagName("ul").get(0);
        assertThat(document.children(list)).hasSize(2);
    }

    @Test
    void descriptionTermsAndDetailsCloseEachOther() {
        final var document = TreeConstructor.parse("<dl><dt>x<dd>y</dl>");
        assertThat(serialize(document)).isEqualTo("<dl><dt>x</dt><dd>y</dd></dl>");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "<p>a<p>b|<p>a</p><p>b</p>",
        "<p>a<h1>b</h1>|<p>a</p><h1>b</h1>",
        "<p>a<table></table>|<p>a</p><table></table>",
        "<p>a<form></form>|<p>a</p><form></form>",
        "<p>a<div>b</div>|<p>a<div>b</div></p>",
        "<table><tr><td>1<td>2<tr><td>3</table>|<table><tr><td>1</td><td>2</td></tr><tr><td>3</td></tr></table>",
        "<table><tr><th>h<td>d</table>|<table><tr><th>h</th><td>d</td></tr></table>",
    })
    void appliesImplicitCloseRules(final String input, final String expected) {
        assertThat(serialize(TreeConstructor.parse(input))).isEqualTo(expected);
    }

    @Test
    void endTagWithAttributesStillCloses() {
        final var document = TreeConstructor.parse("<div>a</div class=\"x\">b");
        assertThat(serialize(document)).isEqualTo("<div>a</div>b");
    }

    @Test
    void unmatchedEndTagIsDropped() {
        try (final var recorder = new ConditionRecorder()) {
            final var document = TreeConstructor.parse("<div>a</span>b</div>");
            assertThat(serialize(document)).isEqualTo("<div>ab</div>");
            assertThat(recorder.ofType(HtmlParseErrorCondition.class)).hasSize(1);
        }
    }

    @Test
    void endTagClosesEverythingAboveTheMatch() {
        final var document = TreeConstructor.parse("<div><span><b>x</div>y");
        assertThat(serialize(document)).isEqualTo("<div><span><b>x</b></span></div>y");
    }

    @Test
    void unclosedElementsAtEndOfInputStayInPlace() {
        final var document = TreeConstructor.parse("<html><body><p>text");
        assertThat(serialize(document)).isEqualTo("<html><body><p>text</p></body></html>");
        assertThat(document.parent(document.elementsByTagName("p").get(0)))
            .isEqualTo(document.elementsByTagName("body").get(0));
    }

    @Test
    void voidElementsHaveNoChildren() {
        final var document = TreeConstructor.parse("<p>a<br>b<img src=x.png>c</p>");
        assertThat(serialize(document)).isEqualTo("<p>a<br>b<img src=\"x.png\">c</p>");
        final var br = document.elementsByTagName("br").get(0);
        assertThat(document.firstChild(br)).isEqualTo(Document.NONE);
    }

    @Test
    void selfClosingFlagOnNonVoidElementIsIgnored() {
        try (final var recorder = new ConditionRecorder()) {
            final var document = TreeConstructor.parse("<div/>inside</div>");
            assertThat(serialize(document)).isEqualTo("<div>inside</div>");
            assertThat(recorder.ofType(HtmlParseErrorCondition.class)).hasSize(1);
        }
    }

    @Test
    void commentsAreKeptAsNodes() {
        final var document = TreeConstructor.parse("<div><!-- c -->x</div>");
        final var div = document.elementsByTagName("div").get(0);
        final var first = document.firstChild(div);
        assertThat(document.node(first)).isEqualTo(new Node.Comment(" c "));
        assertThat(document.node(document.nextSibling(first))).isEqualTo(new Node.Text("x"));
    }

    @Test
    void rawTextContentIsSingleTextNode() {
        final var document = TreeConstructor.parse("<style>p > a { color: red }</style>");
        final var style = document.elementsByTagName("style").get(0);
        assertThat(document.textContent(style)).isEqualTo("p > a { color: red }");
        assertThat(serialize(document)).isEqualTo("<style>p > a { color: red }</style>");
    }

    @Test
    void everyNodeButTheRootHasExactlyOneParent() {
        final var document = TreeConstructor.parse(
            "<html><head><title>t</title></head><body><ul><li>a<li>b</ul><p>x<p>y<table><tr><td>1</table></body>"
        );
        final var visited = new ArrayList<Integer>();
        document.forEachDescendant(Document.ROOT, visited::add);
        assertThat(visited).hasSize(document.size() - 1).doesNotHaveDuplicates();
        for (final int id : visited) {
            final var parent = document.parent(id);
            assertThat(parent).isNotEqualTo(Document.NONE);
            assertThat(document.children(parent)).contains(id);
        }
        assertThat(document.parent(Document.ROOT)).isEqualTo(Document.NONE);
    }

    @Test
    void descendantsAreVisitedInDocumentOrderWithinTheSubtree() {
        final var document = TreeConstructor.parse("<div><p>a</p><span><b>b</b></span><i></i></div><p>c</p>");
        final var visited = new ArrayList<String>();
        document.forEachDescendant(document.elementsByTagName("div").get(0), id -> visited.add(
            (document.node(id) instanceof Node.Text text) ? "#" + text.content() : document.element(id).tagName()
        ));
        assertThat(visited).containsExactly("p", "#a", "span", "b", "#b", "i");
    }

    @Test
    void serializationClosesNestedElementsAndKeepsRawText() {
        final var document = TreeConstructor.parse("<div><p></p><br><!--c--><style>a<b</style><ul><li>x</ul></div>y");
        assertThat(serialize(document))
            .isEqualTo("<div><p></p><br><!--c--><style>a<b</style><ul><li>x</li></ul></div>y");
    }

    @Test
    void adjacentTextIsCoalesced() {
        final var document = TreeConstructor.parse("a</x>b");
        assertThat(document.children(Document.ROOT)).hasSize(1);
        assertThat(document.node(document.firstChild(Document.ROOT))).isEqualTo(new Node.Text("ab"));
    }

    @Test
    void carriesGeneration() {
        assertThat(TreeConstructor.parse("<p>", 7).generation()).isEqualTo(7);
    }

    @Test
    void serializationEscapesText() {
        final var document = TreeConstructor.parse("<p title='a\"b'>1 &lt; 2 &amp;&nbsp;3</p>");
        assertThat(serialize(document)).isEqualTo("<p title=\"a&quot;b\">1 &lt; 2 &amp;&nbsp;3</p>");
    }

    static String serialize(final Document document) {
        final var writer = new StringWriter();
        try {
            Serializer.serialize(writer, document);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
