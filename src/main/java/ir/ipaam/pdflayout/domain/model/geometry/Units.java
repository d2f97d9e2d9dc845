package ir.ipaam.pdflayout.domain.model.geometry;

/** Conversions between PDF points and the millimetres used by the layout engine. */
public final class Units {

    public static final double MM_PER_PT = 25.4 / 72.0;
    public static final double PT_PER_MM = 72.0 / 25.4;

    private Units() {
    }

    public static double ptToMm(double pt) {
        return pt * MM_PER_PT;
    }

    public static double mmToPt(double mm) {
        return mm * PT_PER_MM;
    }
}
