package ir.ipaam.pdflayout.domain.render;

import ir.ipaam.pdflayout.domain.font.Font;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.style.Color;

import java.util.List;

/**
 * A run of text in one font, size and colour.
 *
 * @param baseline start of the baseline
 * @param kerning  adjustment between glyph {@code i} and {@code i + 1} in thousandths
 *                 of an em; one entry less than the code point count of {@code text}
 */
public record TextRun(Position baseline, String text, Font font, int fontSize, Color color,
                      List<Double> kerning) implements DrawOperation {

    public TextRun {
        kerning = List.copyOf(kerning);
    }

    public boolean isKerned() {
        for (Double adjustment : kerning) {
            if (adjustment != 0) {
                return true;
            }
        }
        return false;
    }
}
