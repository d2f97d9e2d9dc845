package ir.ipaam.pdflayout.domain.model.geometry;

/** Common paper formats, portrait orientation, in millimetres. */
public enum PaperSize {
    A3(297, 420),
    A4(210, 297),
    A5(148, 210),
    LETTER(215.9, 279.4),
    LEGAL(215.9, 355.6);

    private final double width;
    private final double height;

    PaperSize(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public Size size() {
        return new Size(width, height);
    }
}
