package ir.ipaam.pdflayout.domain.model.element;

/**
 * Vertical space of a number of lines in the active style. A break that does
 * not fit fills the rest of the page and is not carried over.
 */
public final class Break implements Element {

    private final double lines;

    public Break(double lines) {
        if (lines < 0) {
            throw new IllegalArgumentException("Break must not be negative: " + lines);
        }
        this.lines = lines;
    }

    public double lines() {
        return lines;
    }
}
