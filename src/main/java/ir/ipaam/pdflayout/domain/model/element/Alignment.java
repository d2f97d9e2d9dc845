package ir.ipaam.pdflayout.domain.model.element;

/** Horizontal alignment of paragraph lines. */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT;

    /** Horizontal offset of a line of {@code lineWidth} within {@code available}. */
    public double offset(double lineWidth, double available) {
        return switch (this) {
            case LEFT -> 0;
            case CENTER -> Math.max(0, (available - lineWidth) / 2);
            case RIGHT -> Math.max(0, available - lineWidth);
        };
    }
}
