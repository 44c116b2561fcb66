// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.util.List;
import tessera.layout.FixedFontMetrics;
import tessera.layout.FontSpec;
import tessera.layout.InlineItem;
import tessera.layout.Line;
import tessera.layout.LineBreaker;
import tessera.layout.TextRun;
import tessera.style.Color;
import tessera.style.FontStyle;
import tessera.style.TextAlign;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class LineBreakerTest {
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "hello world|100|hello world",
        "hello world|88|hello world",
        "hello world|87|hello,world",
        "a bb ccc dddd|40|a bb,ccc,dddd",
        "abcdefghijkl mn|40|abcdefghijkl,mn",
        "mn abcdefghijkl op|40|mn,abcdefghijkl,op",
    })
    void latinTextBreaksOnlyAtSpaces(final String text, final double width, final String expected) {
        assertThat(lineTexts(LineBreaker.breakText(text, font, width, metrics)))
            .containsExactly(expected.split(","));
    }

    @Test
    void hanAndKanaBreakBetweenAnyCharacters() {
        final var lines = LineBreaker.breakText("日本語テキスト", font, 50, metrics);
        assertThat(lineTexts(lines)).containsExactly("日本語", "テキス", "ト");
        assertThat(lines.get(0).geometry().width()).isEqualTo(48.0);
    }

    @Test
    void mixedScriptsBreakAtScriptBoundaries() {
        assertThat(lineTexts(LineBreaker.breakText("abc日本", font, 40, metrics))).containsExactly("abc日", "本");
        assertThat(lineTexts(LineBreaker.breakText("日本abc", font, 40, metrics))).containsExactly("日本", "abc");
    }

    @Test
    void hangulIsWideButBreaksOnlyAtSpaces() {
        assertThat(lineTexts(LineBreaker.breakText("한국어 텍스트", font, 60, metrics))).containsExactly("한국어", "텍스트");
    }

    @Test
    void wordsSpanStyleChanges() {
        final var bold = new FontSpec(16, 700, FontStyle.NORMAL);
        final var lines = LineBreaker.breakLines(
            List.of(new InlineItem.Text("hel", bold, Color.black, 1), new InlineItem.Text("lo world", font, Color.black, 2)),
            0,
            0,
            60,
            TextAlign.LEFT,
            font,
            metrics
        );
        assertThat(lineTexts(lines)).containsExactly("hello", "world");
        assertThat(lines.get(0).runs()).extracting(TextRun::text).containsExactly("hel", "lo");
        assertThat(lines.get(0).runs()).extracting(TextRun::nodeId).containsExactly(1, 2);
        assertThat(lines.get(0).runs().get(1).geometry().x()).isEqualTo(24.0);
    }

    @Test
    void whitespaceCollapses() {
        final var lines = LineBreaker.breakLines(
            List.of(text("  a \n\t "), text("  b  ")),
            0,
            0,
            100,
            TextAlign.LEFT,
            font,
            metrics
        );
        assertThat(lineTexts(lines)).containsExactly("a b");
        assertThat(lines.get(0).geometry().width()).isEqualTo(24.0);
    }

    @Test
    void onlyWhitespaceProducesNoLines() {
        assertThat(LineBreaker.breakText(" \n\t ", font, 100, metrics)).isEmpty();
    }

    @Test
    void forcedBreaksEndLines() {
        final var lines = LineBreaker.breakLines(
            List.of(text("a"), new InlineItem.ForcedBreak(), new InlineItem.ForcedBreak(), text(" b")),
            0,
            10,
            100,
            TextAlign.LEFT,
            font,
            metrics
        );
        assertThat(lineTexts(lines)).containsExactly("a", "", "b");
        assertThat(lines).extracting(line -> line.geometry().y()).containsExactly(10.0, 26.0, 42.0);
    }

    @ParameterizedTest
    @CsvSource({
        "LEFT, 5",
        "RIGHT, 89",
        "CENTER, 47",
    })
    void alignsLinesWithinTheAvailableWidth(final TextAlign align, final double expectedX) {
        final var lines = LineBreaker.breakLines(List.of(text("ab")), 5, 0, 100, align, font, metrics);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).geometry().x()).isEqualTo(expectedX);
        assertThat(lines.get(0).runs().get(0).geometry().x()).isEqualTo(expectedX);
    }

    @Test
    void lineHeightFollowsTheTallestRun() {
        final var big = new FontSpec(32, 400, FontStyle.NORMAL);
        final var lines = LineBreaker.breakLines(
            List.of(text("a "), new InlineItem.Text("B", big, Color.black, 1)),
            0,
            0,
            100,
            TextAlign.LEFT,
            font,
            metrics
        );
        final var line = lines.get(0);
        assertThat(line.geometry().height()).isCloseTo(32.0, within(1e-9));
        assertThat(line.baseline()).isCloseTo(25.6, within(1e-9));
        assertThat(line.runs()).allSatisfy(run -> assertThat(run.baseline()).isEqualTo(line.baseline()));
        assertThat(line.runs().get(0).geometry().y()).isCloseTo(25.6 - 12.8, within(1e-9));
    }

    @Test
    void trailingSpacesAreNotPartOfLines() {
        final var lines = LineBreaker.breakText("ab cd ", font, 100, metrics);
        assertThat(lineTexts(lines)).containsExactly("ab cd");
        assertThat(lines.get(0).geometry().width()).isEqualTo(40.0);
    }

    private static InlineItem text(final String text) {
        return new InlineItem.Text(text, font, Color.black, 1);
    }

    private static List<String> lineTexts(final List<Line> lines) {
        return lines.stream().map(Line::text).toList();
    }

    private static final FixedFontMetrics metrics = FixedFontMetrics.instance();
    private static final FontSpec font = new FontSpec(16, 400, FontStyle.NORMAL);
}
