package ir.ipaam.pdflayout.domain.font;

/**
 * Vertical font metrics in thousandths of an em.
 * {@code descent} is negative for glyphs extending below the baseline.
 */
public record VerticalMetrics(double ascent, double descent, double lineGap) {

    public double lineHeight() {
        return ascent - descent + lineGap;
    }
}
