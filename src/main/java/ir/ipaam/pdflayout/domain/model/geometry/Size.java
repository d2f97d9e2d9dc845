package ir.ipaam.pdflayout.domain.model.geometry;

public record Size(double width, double height) {

    public static final Size ZERO = new Size(0, 0);

    public Size {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + width + "x" + height);
        }
    }

    public boolean isZero() {
        return width == 0 && height == 0;
    }

    /** Places {@code other} below this size: heights add up, the wider width wins. */
    public Size stackVertical(Size other) {
        return new Size(Math.max(width, other.width), height + other.height);
    }

    public Size grow(double dw, double dh) {
        return new Size(width + dw, height + dh);
    }
}
