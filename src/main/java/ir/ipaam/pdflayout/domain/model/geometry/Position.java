package ir.ipaam.pdflayout.domain.model.geometry;

/** A point on the page in millimetres, measured from the top left corner. */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
