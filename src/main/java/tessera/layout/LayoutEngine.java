// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.ArrayList;
import java.util.List;
import tessera.dom.Document;
import tessera.dom.Node;
import tessera.style.Color;
import tessera.style.ComputedStyle;
import tessera.style.Display;
import tessera.style.Property;
import tessera.style.StyleFallbackCondition;
import tessera.style.StyledDocument;
import tessera.util.Trace;
import tessera.util.UnreachableCodeReachedError;
import tessera.util.condition.ConditionContext;

/**
 * Turns a styled document into a box tree with absolute geometry.
 * <p>
 * Block-level elements stack vertically, each below the bottom margin edge of its previous sibling; margins never
 * collapse. Inline content, that is text, inline elements and {@code <br>}, is gathered into inline boxes and broken
 * into lines by the {@link LineBreaker}. When inline content sits next to block siblings, it's wrapped in an anonymous
 * block box. Block elements inside inline elements are laid out as part of the surrounding inline content.
 * <p>
 * Layout is a pure function of its inputs: laying out the same styled document at the same width with the same
 * metrics yields equal box trees.
 */
public final class LayoutEngine {
    private LayoutEngine(final StyledDocument styled, final FontMetrics metrics) {
        this.styled = styled;
        this.document = styled.document();
        this.metrics = metrics;
    }

    /**
     * Lays out the given styled document in a viewport of the given width.
     * <p>
     * A percentage {@code height} can't be resolved, as the viewport height doesn't take part in layout. It's treated
     * as {@code auto}, and a non-fatal {@link StyleFallbackCondition} is signaled.
     */
    public static BoxTree layout(final StyledDocument styled, final double viewportWidth, final FontMetrics metrics) {
        final var generation = styled.document().generation();
        try (final var trace = new Trace(() -> "Laying out generation " + generation + " at width " + viewportWidth)) {
            trace.use();
            final var engine = new LayoutEngine(styled, metrics);
            final var children = new ArrayList<Box>();
            final var height = engine.layoutContents(Document.ROOT, 0, 0, viewportWidth, children);
            final var root = new Box.Block(
                Document.ROOT,
                false,
                new Geometry(0, 0, viewportWidth, height),
                Edges.zero,
                Edges.zero,
                Edges.zero,
                Color.transparent,
                Color.transparent,
                children
            );
            return new BoxTree(root, generation, viewportWidth);
        }
    }

    // Lays out the children of the given node into the content area starting at (x, y), returning the height used.
    private double layoutContents(
        final int parent,
        final double x,
        final double y,
        final double width,
        final List<Box> output
    ) {
        final var children = renderedChildren(parent);
        final var hasBlocks = children.stream().anyMatch(this::isBlockLevel);
        final var pending = new ArrayList<InlineItem>();
        var cursor = y;
        for (final int child : children) {
            if (isBlockLevel(child)) {
                cursor = flushInline(parent, pending, x, cursor, width, hasBlocks, output);
                cursor = layoutBlock(child, x, cursor, width, output);
            } else {
                collectInline(child, pending);
            }
        }
        cursor = flushInline(parent, pending, x, cursor, width, hasBlocks, output);
        return cursor - y;
    }

    private double flushInline(
        final int parent,
        final List<InlineItem> pending,
        final double x,
        final double y,
        final double width,
        final boolean anonymous,
        final List<Box> output
    ) {
        if (pending.isEmpty()) {
            return y;
        }
        final var style = styled.style(parent);
        final var lines = LineBreaker.breakLines(
            List.copyOf(pending),
            x,
            y,
            width,
            style.textAlign(),
            FontSpec.of(style),
            metrics
        );
        pending.clear();
        if (lines.isEmpty()) {
            return y;
        }
        final var height = lines.get(lines.size() - 1).geometry().bottom() - y;
        final var geometry = new Geometry(x, y, width, height);
        final var inline = new Box.Inline(parent, geometry, lines);
        if (anonymous) {
            output.add(new Box.Block(
                parent,
                true,
                geometry,
                Edges.zero,
                Edges.zero,
                Edges.zero,
                Color.transparent,
                Color.transparent,
                List.of(inline)
            ));
        } else {
            output.add(inline);
        }
        return y + height;
    }

    // Lays out a block-level element below y, returning the y coordinate of its bottom margin edge.
    private double layoutBlock(
        final int id,
        final double x,
        final double y,
        final double containerWidth,
        final List<Box> output
    ) {
        final var style = styled.style(id);
        final var padding = new Edges(
            style.paddingTop().resolve(containerWidth, 0),
            style.paddingRight().resolve(containerWidth, 0),
            style.paddingBottom().resolve(containerWidth, 0),
            style.paddingLeft().resolve(containerWidth, 0)
        );
        final var border = new Edges(
            style.borderTopWidth(),
            style.borderRightWidth(),
            style.borderBottomWidth(),
            style.borderLeftWidth()
        );
        final var marginTop = style.marginTop().resolve(containerWidth, 0);
        final var marginBottom = style.marginBottom().resolve(containerWidth, 0);
        var marginLeft = style.marginLeft().resolve(containerWidth, 0);
        var marginRight = style.marginRight().resolve(containerWidth, 0);

        final double contentWidth;
        if (style.width().isAuto()) {
            contentWidth = Math.max(
                0,
                containerWidth - marginLeft - marginRight - border.horizontal() - padding.horizontal()
            );
        } else {
            contentWidth = Math.max(0, style.width().resolve(containerWidth, 0));
            if (style.marginLeft().isAuto() && style.marginRight().isAuto()) {
                final var free = containerWidth - contentWidth - border.horizontal() - padding.horizontal();
                marginLeft = Math.max(0, free / 2);
                marginRight = marginLeft;
            }
        }

        final var boxX = x + marginLeft;
        final var boxY = y + marginTop;
        final var children = new ArrayList<Box>();
        final var childrenHeight = layoutContents(
            id,
            boxX + border.left() + padding.left(),
            boxY + border.top() + padding.top(),
            contentWidth,
            children
        );
        final var contentHeight = resolveHeight(id, style, childrenHeight);
        final var geometry = new Geometry(
            boxX,
            boxY,
            contentWidth + border.horizontal() + padding.horizontal(),
            contentHeight + border.vertical() + padding.vertical()
        );
        output.add(new Box.Block(
            id,
            false,
            geometry,
            new Edges(marginTop, marginRight, marginBottom, marginLeft),
            border,
            padding,
            style.backgroundColor(),
            style.borderColor(),
            children
        ));
        return geometry.bottom() + marginBottom;
    }

    private double resolveHeight(final int id, final ComputedStyle style, final double childrenHeight) {
        final var height = style.height();
        return switch (height.kind()) {
            case AUTO -> childrenHeight;
            case PX -> Math.max(0, height.value());
            case PERCENT -> {
                ConditionContext.signal(new StyleFallbackCondition(
                    Property.HEIGHT,
                    height.toString(),
                    "<" + document.element(id).tagName() + "> (node " + id + ")"
                ));
                yield childrenHeight;
            }
        };
    }

    private void collectInline(final int id, final List<InlineItem> output) {
        final var node = document.node(id);
        if (node instanceof Node.Text text) {
            final var style = styled.style(id);
            output.add(new InlineItem.Text(text.content(), FontSpec.of(style), style.color(), id));
        } else if (node instanceof Node.Element element) {
            if (element.hasTagName("br")) {
                output.add(forcedBreak);
                return;
            }
            for (final int child : renderedChildren(id)) {
                collectInline(child, output);
            }
        } else {
            throw new UnreachableCodeReachedError("Unexpected inline node: " + node);
        }
    }

    private boolean isBlockLevel(final int id) {
        return document.isElement(id) && styled.style(id).display() == Display.BLOCK;
    }

    private List<Integer> renderedChildren(final int id) {
        final var result = new ArrayList<Integer>();
        for (final int child : document.children(id)) {
            if (styled.isRendered(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private final StyledDocument styled;
    private final Document document;
    private final FontMetrics metrics;

    private static final InlineItem forcedBreak = new InlineItem.ForcedBreak();
}
