// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.util.List;
import tessera.css.Origin;
import tessera.css.Parser;
import tessera.dom.Document;
import tessera.html.TreeConstructor;
import tessera.layout.Box;
import tessera.layout.BoxTree;
import tessera.layout.BoxVerifier;
import tessera.layout.Edges;
import tessera.layout.FixedFontMetrics;
import tessera.layout.Geometry;
import tessera.layout.LayoutEngine;
import tessera.style.Property;
import tessera.style.StyleFallbackCondition;
import tessera.style.StyleResolver;
import tessera.style.StyledDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import org.junit.jupiter.api.Test;

final class LayoutEngineTest {
    @Test
    void stacksBlocksWithDefaultMargins() {
        final var styled = style("<body><p>hello world</p></body>", "");
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        final var body = (Box.Block) tree.root().children().get(0);
        final var p = (Box.Block) body.children().get(0);
        assertThat(tree.root().geometry()).isEqualTo(new Geometry(0, 0, 800, 64));
        assertThat(body.geometry()).isEqualTo(new Geometry(8, 8, 784, 48));
        assertThat(body.margin()).isEqualTo(new Edges(8, 8, 8, 8));
        assertThat(p.geometry()).isEqualTo(new Geometry(8, 24, 784, 16));
        final var inline = (Box.Inline) p.children().get(0);
        assertThat(inline.nodeId()).isEqualTo(p.nodeId());
        assertThat(inline.lines()).hasSize(1);
        assertThat(inline.lines().get(0).geometry()).isEqualTo(new Geometry(8, 24, 88, 16));
    }

    @Test
    void layoutIsDeterministic() {
        final var styled = style(
            "<body><h1>Title</h1><p>Some <b>bold</b> and <i>slanted</i> text, 日本語も.</p><ul><li>one<li>two</ul></body>",
            "ul { border: 1px solid black; padding: 4px }"
        );
        final var first = LayoutEngine.layout(styled, 300, metrics);
        final var second = LayoutEngine.layout(styled, 300, metrics);
        assertThat(second).isEqualTo(first);
        assertThat(second.hashCode()).isEqualTo(first.hashCode());
    }

    @Test
    void narrowerViewportWrapsText() {
        final var styled = style("<p>alpha beta gamma delta</p>", "p { margin: 0 }");
        final var wide = LayoutEngine.layout(styled, 800, metrics);
        final var narrow = LayoutEngine.layout(styled, 100, metrics);
        assertThat(wide.root().geometry().height()).isEqualTo(16.0);
        assertThat(narrow.root().geometry().height()).isEqualTo(32.0);
        assertThat(narrow.viewportWidth()).isEqualTo(100.0);
    }

    @Test
    void inlineContentNextToBlocksIsWrappedInAnonymousBlocks() {
        final var styled = style("<div>head<p>para</p>tail</div>", "p { margin: 0 }");
        final var tree = LayoutEngine.layout(styled, 400, metrics);
        final var div = (Box.Block) tree.root().children().get(0);
        assertThat(div.children()).hasSize(3);
        final var head = (Box.Block) div.children().get(0);
        final var p = (Box.Block) div.children().get(1);
        final var tail = (Box.Block) div.children().get(2);
        assertThat(head.anonymous()).isTrue();
        assertThat(head.nodeId()).isEqualTo(div.nodeId());
        assertThat(p.anonymous()).isFalse();
        assertThat(tail.anonymous()).isTrue();
        assertThat(List.of(head.geometry().y(), p.geometry().y(), tail.geometry().y())).containsExactly(0.0, 16.0, 32.0);
        assertThat(div.geometry().height()).isEqualTo(48.0);
    }

    @Test
    void displayNoneGeneratesNoBoxes() {
        final var styled = style("<div>a</div><div id=gone>b</div><div>c</div>", "#gone { display: none }");
        final var tree = LayoutEngine.layout(styled, 400, metrics);
        assertThat(tree.root().children()).hasSize(2);
        assertThat(tree.root().geometry().height()).isEqualTo(32.0);
    }

    @Test
    void whitespaceBetweenBlocksGeneratesNoBoxes() {
        final var styled = style("<div>a</div>\n  <div>b</div>\n", "");
        final var tree = LayoutEngine.layout(styled, 400, metrics);
        assertThat(tree.root().children()).hasSize(2).allMatch(box -> !((Box.Block) box).anonymous());
    }

    @Test
    void blocksInsideInlineElementsJoinTheInlineContent() {
        final var styled = style("<span>a <div>b</div> c</span>", "");
        final var tree = LayoutEngine.layout(styled, 400, metrics);
        assertThat(tree.root().children()).hasSize(1);
        final var inline = (Box.Inline) tree.root().children().get(0);
        assertThat(inline.lines().get(0).text()).isEqualTo("a b c");
    }

    @Test
    void explicitWidthWithAutoMarginsIsCentred() {
        final var styled = style("<div>x</div>", "div { width: 200px; margin: 0 auto; padding: 10px; border: 5px solid }");
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        final var div = (Box.Block) tree.root().children().get(0);
        assertThat(div.geometry()).isEqualTo(new Geometry(285, 0, 230, 46));
        assertThat(div.contentGeometry()).isEqualTo(new Geometry(300, 15, 200, 16));
        assertThat(div.margin().left()).isEqualTo(div.margin().right());
    }

    @Test
    void percentagesResolveAgainstTheContainingBlockWidth() {
        final var styled = style("<div><p>x</p></div>", "div { width: 400px } p { margin: 0 0 0 10%; width: 50% }");
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        final var div = (Box.Block) tree.root().children().get(0);
        final var p = (Box.Block) div.children().get(0);
        assertThat(p.geometry().x()).isEqualTo(40.0);
        assertThat(p.geometry().width()).isEqualTo(200.0);
    }

    @Test
    void explicitHeightOverridesContentHeight() {
        final var styled = style("<div>x</div>", "div { height: 100px }");
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        assertThat(tree.root().children().get(0).geometry().height()).isEqualTo(100.0);
    }

    @Test
    void percentageHeightFallsBackToAutoWithCondition() {
        final var styled = style("<div>x</div>", "div { height: 50% }");
        try (final var recorder = new ConditionRecorder()) {
            final var tree = LayoutEngine.layout(styled, 800, metrics);
            assertThat(tree.root().children().get(0).geometry().height()).isEqualTo(16.0);
            assertThat(recorder.ofType(StyleFallbackCondition.class))
                .extracting(StyleFallbackCondition::property)
                .containsExactly(Property.HEIGHT);
        }
    }

    @Test
    void overconstrainedMarginsClampContentWidthToZero() {
        final var styled = style("<div></div>", "div { margin-left: 900px }");
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        assertThat(tree.root().children().get(0).geometry().width()).isEqualTo(0.0);
    }

    @Test
    void oversizedLengthsLeaveGeometryFinite() {
        final var styled = style("<div style='width: 1e400px; margin-left: 1e400px'>x</div>", "");
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        assertThat(tree.root().children().get(0).geometry()).isEqualTo(new Geometry(0, 0, 800, 16));
        assertThatCode(() -> BoxVerifier.verify(tree, styled.document())).doesNotThrowAnyException();
    }

    @Test
    void nestedHugePercentagesStayFinite() {
        final var styled = style(
            "<div class=a><div class=a><div class=a><div class=a>x</div></div></div></div>",
            ".a { width: 3000000% }"
        );
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        assertThatCode(() -> BoxVerifier.verify(tree, styled.document())).doesNotThrowAnyException();
    }

    @Test
    void hitTestingFindsTheDeepestNode() {
        final var styled = style("<body><p>hello world</p></body>", "");
        final var tree = LayoutEngine.layout(styled, 800, metrics);
        final var document = styled.document();
        final var p = document.elementsByTagName("p").get(0);
        final var body = document.elementsByTagName("body").get(0);
        assertThat(tree.hitTest(10, 30)).map(BoxTree.Hit::nodeId).contains(document.firstChild(p));
        assertThat(tree.hitTest(500, 30)).map(BoxTree.Hit::nodeId).contains(p);
        assertThat(tree.hitTest(500, 10)).map(BoxTree.Hit::nodeId).contains(body);
        assertThat(tree.hitTest(2, 2)).map(BoxTree.Hit::nodeId).contains(Document.ROOT);
        assertThat(tree.hitTest(900, 2)).isEmpty();
    }

    @Test
    void treeCarriesTheDocumentGeneration() {
        final var document = TreeConstructor.parse("<p>x</p>", 42);
        final var styled = StyleResolver.resolveWithDefaults(document, List.of());
        assertThat(LayoutEngine.layout(styled, 800, metrics).generation()).isEqualTo(42);
    }

    private static StyledDocument style(final String html, final String css) {
        final var document = TreeConstructor.parse(html);
        return StyleResolver.resolveWithDefaults(document, List.of(Parser.parseStylesheet(css, Origin.AUTHOR)));
    }

    private static final FixedFontMetrics metrics = FixedFontMetrics.instance();
}
