package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.font.Font;
import ir.ipaam.pdflayout.domain.font.FontBackend;
import ir.ipaam.pdflayout.domain.font.VerticalMetrics;
import ir.ipaam.pdflayout.domain.model.geometry.Units;
import ir.ipaam.pdflayout.domain.model.style.Style;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts font metrics into millimetres for a resolved style.
 * <p>
 * Widths are the sum of the glyph advances plus the kerning of every adjacent
 * glyph pair. Pairs crossing from one string to the next are kerned as well when
 * both strings use the same font at the same size, so splitting a string into
 * equally styled pieces never changes its width.
 */
public class TextMeasurer {

    private final FontBackend fonts;

    public TextMeasurer(FontBackend fonts) {
        this.fonts = fonts;
    }

    /** Millimetres per thousandth of an em at the style's font size. */
    public double scale(Style style) {
        return Units.ptToMm(style.fontSize()) / 1000.0;
    }

    public double width(Style style, String text) {
        Font font = style.font();
        int[] codePoints = text.codePoints().toArray();
        double units = 0;
        for (int i = 0; i < codePoints.length; i++) {
            units += fonts.advance(font, codePoints[i]);
            if (i + 1 < codePoints.length) {
                units += fonts.kerning(font, codePoints[i], codePoints[i + 1]);
            }
        }
        return units * scale(style);
    }

    /**
     * Kerning between the last glyph of a string in {@code left} and the first
     * glyph of the following string in {@code right}, in millimetres.
     */
    public double kerningBetween(Style left, int leftCodePoint, Style right, int rightCodePoint) {
        if (!sameFace(left, right)) {
            return 0;
        }
        return fonts.kerning(left.font(), leftCodePoint, rightCodePoint) * scale(left);
    }

    /** Per glyph pair kerning of {@code text} in thousandths of an em. */
    public List<Double> kerning(Style style, String text) {
        Font font = style.font();
        int[] codePoints = text.codePoints().toArray();
        List<Double> kerning = new ArrayList<>(Math.max(0, codePoints.length - 1));
        for (int i = 0; i + 1 < codePoints.length; i++) {
            kerning.add(fonts.kerning(font, codePoints[i], codePoints[i + 1]));
        }
        return kerning;
    }

    public double lineHeight(Style style) {
        return metrics(style).lineHeight() * scale(style) * style.lineSpacing();
    }

    public double ascent(Style style) {
        return metrics(style).ascent() * scale(style);
    }

    public static boolean sameFace(Style left, Style right) {
        return left.font().equals(right.font()) && left.fontSize() == right.fontSize();
    }

    private VerticalMetrics metrics(Style style) {
        return fonts.verticalMetrics(style.font());
    }
}
