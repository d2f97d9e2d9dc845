package ir.ipaam.pdflayout.domain.model.style;

/** Stroke used for frames and cell borders. Thickness is in millimetres. */
public record LineStyle(double thickness, Color color) {

    public static final double DEFAULT_THICKNESS = 0.1;

    public LineStyle {
        if (thickness <= 0) {
            throw new IllegalArgumentException("Line thickness must be positive: " + thickness);
        }
        if (color == null) {
            color = Color.BLACK;
        }
    }

    public LineStyle() {
        this(DEFAULT_THICKNESS, Color.BLACK);
    }

    public LineStyle withThickness(double thickness) {
        return new LineStyle(thickness, color);
    }

    public LineStyle withColor(Color color) {
        return new LineStyle(thickness, color);
    }
}
