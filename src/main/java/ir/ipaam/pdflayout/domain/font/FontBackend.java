package ir.ipaam.pdflayout.domain.font;

import ir.ipaam.pdflayout.domain.exception.ConfigurationException;

/**
 * Glyph metric queries used by the layout engine. All widths are expressed in
 * thousandths of an em, independent of font size.
 * <p>
 * Implementations are read-only once constructed and may be shared between
 * documents and threads.
 */
public interface FontBackend {

    /**
     * Looks up a family by name.
     *
     * @throws ConfigurationException if no usable family can be resolved
     */
    FontFamily resolveFamily(String name) throws ConfigurationException;

    /** Advance width of a single code point. */
    double advance(Font font, int codePoint);

    /** Adjustment added to the advance of {@code left} when followed by {@code right}. */
    double kerning(Font font, int left, int right);

    VerticalMetrics verticalMetrics(Font font);

    /** Advance widths of every code point of {@code text}, kerning not applied. */
    default double[] measure(Font font, String text) {
        return text.codePoints().mapToDouble(cp -> advance(font, cp)).toArray();
    }
}
