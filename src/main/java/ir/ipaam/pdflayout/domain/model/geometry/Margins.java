package ir.ipaam.pdflayout.domain.model.geometry;

public record Margins(double top, double right, double bottom, double left) {

    public static final Margins NONE = new Margins(0, 0, 0, 0);

    public static Margins all(double value) {
        return new Margins(value, value, value, value);
    }

    public static Margins trbl(double top, double right, double bottom, double left) {
        return new Margins(top, right, bottom, left);
    }

    public double horizontal() {
        return left + right;
    }

    public double vertical() {
        return top + bottom;
    }
}
