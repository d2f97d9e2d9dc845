package ir.ipaam.pdflayout.domain.model.style;

import ir.ipaam.pdflayout.domain.font.Font;
import ir.ipaam.pdflayout.domain.font.FontFamily;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Immutable, partially specified text style.
 * <p>
 * Every attribute may be left unset. Styles are combined with {@link #merge(Style)}:
 * attributes set on the local style replace those of the ancestor, unset ones are
 * inherited. The document root style sets every attribute, so a style resolved
 * through the full ancestor chain is always complete.
 */
@EqualsAndHashCode
@ToString
public final class Style {

    public static final int DEFAULT_FONT_SIZE = 12;
    public static final double DEFAULT_LINE_SPACING = 1.0;

    private static final Style EMPTY = new Style(null, null, null, null, null, null);

    private final FontFamily fontFamily;
    private final Integer fontSize;
    private final Double lineSpacing;
    private final Color color;
    private final Boolean bold;
    private final Boolean italic;

    private Style(FontFamily fontFamily, Integer fontSize, Double lineSpacing,
                  Color color, Boolean bold, Boolean italic) {
        this.fontFamily = fontFamily;
        this.fontSize = fontSize;
        this.lineSpacing = lineSpacing;
        this.color = color;
        this.bold = bold;
        this.italic = italic;
    }

    public static Style empty() {
        return EMPTY;
    }

    /** A fully resolved root style for the given family. */
    public static Style defaults(FontFamily family) {
        return new Style(family, DEFAULT_FONT_SIZE, DEFAULT_LINE_SPACING, Color.BLACK, false, false);
    }

    /** Resolves {@code local} against {@code ancestor}. */
    public static Style resolve(Style ancestor, Style local) {
        return ancestor.merge(local);
    }

    public Style merge(Style local) {
        if (local == null || local == EMPTY) {
            return this;
        }
        return new Style(
                local.fontFamily != null ? local.fontFamily : fontFamily,
                local.fontSize != null ? local.fontSize : fontSize,
                local.lineSpacing != null ? local.lineSpacing : lineSpacing,
                local.color != null ? local.color : color,
                local.bold != null ? local.bold : bold,
                local.italic != null ? local.italic : italic);
    }

    public Style withFontSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Font size must be positive: " + size);
        }
        return new Style(fontFamily, size, lineSpacing, color, bold, italic);
    }

    public Style withLineSpacing(double spacing) {
        if (spacing <= 0) {
            throw new IllegalArgumentException("Line spacing must be positive: " + spacing);
        }
        return new Style(fontFamily, fontSize, spacing, color, bold, italic);
    }

    public Style withColor(Color color) {
        return new Style(fontFamily, fontSize, lineSpacing, color, bold, italic);
    }

    public Style withBold(boolean bold) {
        return new Style(fontFamily, fontSize, lineSpacing, color, bold, italic);
    }

    public Style withItalic(boolean italic) {
        return new Style(fontFamily, fontSize, lineSpacing, color, bold, italic);
    }

    public Style bold() {
        return withBold(true);
    }

    public Style italic() {
        return withItalic(true);
    }

    public FontFamily fontFamily() {
        return fontFamily;
    }

    public int fontSize() {
        return fontSize != null ? fontSize : DEFAULT_FONT_SIZE;
    }

    public double lineSpacing() {
        return lineSpacing != null ? lineSpacing : DEFAULT_LINE_SPACING;
    }

    public Color color() {
        return color != null ? color : Color.BLACK;
    }

    public boolean isBold() {
        return bold != null && bold;
    }

    public boolean isItalic() {
        return italic != null && italic;
    }

    /** The face of the style's family matching its emphasis. */
    public Font font() {
        if (fontFamily == null) {
            throw new IllegalStateException("Style has no font family; resolve it against the document style first");
        }
        return fontFamily.font(isBold(), isItalic());
    }
}
