// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import tessera.dom.Document;
import tessera.style.Color;
import tessera.style.TextAlign;
import tessera.util.annotation.Nullable;

/**
 * Script-aware greedy line breaking.
 * <p>
 * Whitespace is collapsed first: every run of spaces, tabs and newlines becomes one space, and a space directly after
 * another one or at the very start is dropped. The text is then split into grapheme clusters. Clusters of scripts
 * written without word separators, such as Han or Kana, are breakable units of their own; runs of other non-space
 * clusters form words, which may span several text items and are only breakable at spaces. Styling changes how units
 * are measured but never where breaks are allowed.
 * <p>
 * Units are placed greedily: a line is broken before the first unit that doesn't fit. A unit wider than the whole line
 * is placed alone on its own line. Spaces at line ends are dropped.
 */
public final class LineBreaker {
    private LineBreaker(
        final List<InlineItem> items,
        final FontMetrics metrics,
        final double x,
        final double y,
        final double width,
        final TextAlign align,
        final FontSpec blockFont
    ) {
        this.items = items;
        this.metrics = metrics;
        this.x = x;
        this.cursorY = y;
        this.width = width;
        this.align = align;
        this.blockFont = blockFont;
    }

    /**
     * Breaks the given inline content into lines.
     *
     * @param items     The inline content, in document order.
     * @param x         The left edge of the lines.
     * @param y         The top of the first line.
     * @param width     The available line width.
     * @param align     How to align each line within the available width.
     * @param blockFont The font of the element establishing the lines, which sets the height of empty lines.
     * @param metrics   The font metrics to measure with.
     * @return The lines, top to bottom. Empty if the content has nothing but collapsible whitespace.
     */
    public static List<Line> breakLines(
        final List<InlineItem> items,
        final double x,
        final double y,
        final double width,
        final TextAlign align,
        final FontSpec blockFont,
        final FontMetrics metrics
    ) {
        final var breaker = new LineBreaker(collapseWhitespace(items), metrics, x, y, width, align, blockFont);
        breaker.segment();
        return breaker.place();
    }

    /**
     * Breaks a single string of uniformly styled black text, left-aligned at the origin. The runs are attributed to the
     * document root.
     */
    public static List<Line> breakText(
        final String text,
        final FontSpec font,
        final double width,
        final FontMetrics metrics
    ) {
        final var item = new InlineItem.Text(text, font, Color.black, Document.ROOT);
        return breakLines(List.of(item), 0, 0, width, TextAlign.LEFT, font, metrics);
    }

    private static List<InlineItem> collapseWhitespace(final List<InlineItem> items) {
        final var result = new ArrayList<InlineItem>();
        var afterSpace = true;
        for (final var item : items) {
            if (item instanceof InlineItem.Text textItem) {
                var text = collapse(textItem.text());
                if (afterSpace && text.startsWith(" ")) {
                    text = text.substring(1);
                }
                if (text.isEmpty()) {
                    continue;
                }
                afterSpace = text.endsWith(" ");
                result.add(new InlineItem.Text(text, textItem.font(), textItem.color(), textItem.nodeId()));
            } else {
                afterSpace = true;
                result.add(item);
            }
        }
        return result;
    }

    private static String collapse(final String text) {
        final var builder = new StringBuilder(text.length());
        var inWhitespace = false;
        for (int i = 0; i < text.length(); i += 1) {
            final var c = text.charAt(i);
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f') {
                if (!inWhitespace) {
                    builder.append(' ');
                }
                inWhitespace = true;
            } else {
                builder.append(c);
                inWhitespace = false;
            }
        }
        return builder.toString();
    }

    private void segment() {
        for (int index = 0; index < items.size(); index += 1) {
            final var item = items.get(index);
            if (!(item instanceof InlineItem.Text textItem)) {
                flushWord();
                measurements.add(null);
                units.add(new Unit(Kind.BREAK, List.of(), 0));
                continue;
            }
            final var text = textItem.text();
            final var measurement = metrics.measure(textItem.font(), text);
            measurements.add(measurement);
            final var clusters = BreakIterator.getCharacterInstance();
            clusters.setText(text);
            var wordStart = -1;
            for (int start = clusters.first(), end = clusters.next();
                 end != BreakIterator.DONE;
                 start = end, end = clusters.next()) {
                final var codePoint = text.codePointAt(start);
                if (codePoint == ' ' || Scripts.breaksAnywhere(codePoint)) {
                    closeFragment(index, wordStart, start, measurement);
                    flushWord();
                    wordStart = -1;
                    final var fragment = new Fragment(index, start, end, measurement.width(start, end));
                    units.add(new Unit((codePoint == ' ') ? Kind.SPACE : Kind.WORD, List.of(fragment), fragment.width()));
                } else if (wordStart < 0) {
                    wordStart = start;
                }
            }
            // A word may continue into the next item, so it isn't flushed here.
            closeFragment(index, wordStart, text.length(), measurement);
        }
        flushWord();
    }

    private void closeFragment(final int item, final int start, final int end, final Measurement measurement) {
        if (start >= 0 && end > start) {
            currentWord.add(new Fragment(item, start, end, measurement.width(start, end)));
        }
    }

    private void flushWord() {
        if (currentWord.isEmpty()) {
            return;
        }
        var wordWidth = 0.0;
        for (final var fragment : currentWord) {
            wordWidth += fragment.width();
        }
        units.add(new Unit(Kind.WORD, List.copyOf(currentWord), wordWidth));
        currentWord.clear();
    }

    private List<Line> place() {
        final var line = new ArrayList<Fragment>();
        var lineWidth = 0.0;
        @Nullable Unit pendingSpace = null;
        for (final var unit : units) {
            switch (unit.kind()) {
                case BREAK -> {
                    finishLine(line);
                    line.clear();
                    lineWidth = 0;
                    pendingSpace = null;
                }
                case SPACE -> {
                    if (!line.isEmpty()) {
                        pendingSpace = unit;
                    }
                }
                case WORD -> {
                    var spaceWidth = (pendingSpace != null) ? pendingSpace.width() : 0.0;
                    if (!line.isEmpty() && lineWidth + spaceWidth + unit.width() > width + epsilon) {
                        finishLine(line);
                        line.clear();
                        lineWidth = 0;
                        pendingSpace = null;
                        spaceWidth = 0;
                    }
                    if (pendingSpace != null) {
                        line.addAll(pendingSpace.fragments());
                        lineWidth += spaceWidth;
                        pendingSpace = null;
                    }
                    line.addAll(unit.fragments());
                    lineWidth += unit.width();
                }
            }
        }
        if (!line.isEmpty()) {
            finishLine(line);
        }
        return lines;
    }

    private void finishLine(final List<Fragment> fragments) {
        if (fragments.isEmpty()) {
            final var empty = metrics.measure(blockFont, "");
            lines.add(new Line(new Geometry(alignedX(0), cursorY, 0, empty.lineHeight()), cursorY + empty.ascent(),
                List.of()));
            cursorY += empty.lineHeight();
            return;
        }
        final var groups = groupFragments(fragments);
        var maxAscent = 0.0;
        var maxDescent = 0.0;
        var maxLineHeight = 0.0;
        var contentWidth = 0.0;
        for (final var group : groups) {
            final var measurement = measurementOf(group.item());
            maxAscent = Math.max(maxAscent, measurement.ascent());
            maxDescent = Math.max(maxDescent, measurement.descent());
            maxLineHeight = Math.max(maxLineHeight, measurement.lineHeight());
            contentWidth += group.width();
        }
        final var lineHeight = Math.max(maxLineHeight, maxAscent + maxDescent);
        final var baseline = cursorY + (lineHeight - maxAscent - maxDescent) / 2 + maxAscent;
        final var lineX = alignedX(contentWidth);
        var runX = lineX;
        final var runs = new ArrayList<TextRun>();
        for (final var group : groups) {
            final var textItem = (InlineItem.Text) items.get(group.item());
            final var measurement = measurementOf(group.item());
            final var geometry = new Geometry(
                runX,
                baseline - measurement.ascent(),
                group.width(),
                measurement.ascent() + measurement.descent()
            );
            runs.add(new TextRun(
                textItem.text().substring(group.start(), group.end()),
                geometry,
                baseline,
                textItem.font(),
                textItem.color(),
                textItem.nodeId()
            ));
            runX += group.width();
        }
        lines.add(new Line(new Geometry(lineX, cursorY, contentWidth, lineHeight), baseline, runs));
        cursorY += lineHeight;
    }

    // Merges adjacent fragments of the same item into one fragment per run.
    private static List<Fragment> groupFragments(final List<Fragment> fragments) {
        final var result = new ArrayList<Fragment>();
        for (final var fragment : fragments) {
            final var lastIndex = result.size() - 1;
            if (lastIndex >= 0 && result.get(lastIndex).item() == fragment.item()
                && result.get(lastIndex).end() == fragment.start()) {
                final var last = result.get(lastIndex);
                result.set(lastIndex, new Fragment(last.item(), last.start(), fragment.end(),
                    last.width() + fragment.width()));
            } else {
                result.add(fragment);
            }
        }
        return result;
    }

    private Measurement measurementOf(final int item) {
        final var measurement = measurements.get(item);
        assert measurement != null : "Forced breaks have no measurement";
        return measurement;
    }

    private double alignedX(final double contentWidth) {
        final var free = Math.max(0, width - contentWidth);
        return switch (align) {
            case LEFT -> x;
            case RIGHT -> x + free;
            case CENTER -> x + free / 2;
        };
    }

    private final List<InlineItem> items;
    private final FontMetrics metrics;
    private final double x;
    private final double width;
    private final TextAlign align;
    private final FontSpec blockFont;
    private double cursorY;

    private final ArrayList<@Nullable Measurement> measurements = new ArrayList<>();
    private final ArrayList<Unit> units = new ArrayList<>();
    private final ArrayList<Fragment> currentWord = new ArrayList<>();
    private final ArrayList<Line> lines = new ArrayList<>();

    private static final double epsilon = 1e-9;

    private enum Kind {
        WORD,
        SPACE,
        BREAK,
    }

    private record Fragment(int item, int start, int end, double width) {
    }

    private record Unit(Kind kind, List<Fragment> fragments, double width) {
    }
}
