// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.util.List;
import tessera.dom.Document;
import tessera.html.TreeConstructor;
import tessera.layout.Box;
import tessera.layout.BoxTree;
import tessera.layout.BoxVerifier;
import tessera.layout.Edges;
import tessera.layout.FixedFontMetrics;
import tessera.layout.Geometry;
import tessera.layout.InvariantViolationCondition;
import tessera.layout.LayoutEngine;
import tessera.style.Color;
import tessera.style.StyleResolver;
import tessera.util.condition.ConditionContext;
import tessera.util.condition.Handler;
import tessera.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

final class BoxVerifierTest {
    @Test
    void acceptsTreeLaidOutFromTheSameDocument() {
        final var document = TreeConstructor.parse("<body><p>a <b>b</b></p><div>c</div></body>", 3);
        final var tree = layout(document);
        assertThatCode(() -> BoxVerifier.verify(tree, document)).doesNotThrowAnyException();
    }

    @Test
    void rejectsTreeOfAnotherGeneration() {
        final var tree = layout(TreeConstructor.parse("<p>x</p>", 1));
        final var newer = TreeConstructor.parse("<p>x</p>", 2);
        try (final var recorder = new ConditionRecorder()) {
            assertThatThrownBy(() -> BoxVerifier.verify(tree, newer)).isInstanceOf(UnhandledErrorError.class);
            final var violations = recorder.ofType(InvariantViolationCondition.class);
            assertThat(violations).hasSize(1);
            assertThat(violations.get(0).violations()).anySatisfy(
                violation -> assertThat(violation).contains("generation 1").contains("generation 2")
            );
        }
    }

    @Test
    void rejectsBoxesOfForeignNodesAndMalformedGeometry() {
        final var document = TreeConstructor.parse("<p>x</p>", 0);
        final var textNode = document.firstChild(document.elementsByTagName("p").get(0));
        final var root = new Box.Block(
            Document.ROOT,
            false,
            new Geometry(0, 0, 100, 10),
            Edges.zero,
            Edges.zero,
            Edges.zero,
            Color.transparent,
            Color.transparent,
            List.of(
                block(textNode, new Geometry(0, 0, 10, 10)),
                block(99, new Geometry(0, 0, 10, 10)),
                block(Document.ROOT, new Geometry(0, 0, -1, Double.NaN))
            )
        );
        try (final var recorder = new ConditionRecorder()) {
            assertThatThrownBy(() -> BoxVerifier.verify(new BoxTree(root, 0, 100), document))
                .isInstanceOf(UnhandledErrorError.class);
            assertThat(recorder.ofType(InvariantViolationCondition.class).get(0).violations()).hasSize(3);
        }
    }

    @Test
    void handlerCanAbandonPublication() {
        final var tree = layout(TreeConstructor.parse("<p>x</p>", 1));
        final var newer = TreeConstructor.parse("<p>y</p>", 2);
        final var result = ConditionContext.withRestart("abandon", restart -> {
            try (final var handler = new Handler(condition -> {
                if (condition.isFatal() && condition.condition() instanceof InvariantViolationCondition) {
                    restart.unwindTo();
                }
            })) {
                handler.use();
                BoxVerifier.verify(tree, newer);
                return "published";
            }
        });
        assertThat(result).isNull();
    }

    private static BoxTree layout(final Document document) {
        return LayoutEngine.layout(
            StyleResolver.resolveWithDefaults(document, List.of()),
            640,
            FixedFontMetrics.instance()
        );
    }

    private static Box block(final int nodeId, final Geometry geometry) {
        return new Box.Block(
            nodeId,
            false,
            geometry,
            Edges.zero,
            Edges.zero,
            Edges.zero,
            Color.transparent,
            Color.transparent,
            List.of()
        );
    }
}
