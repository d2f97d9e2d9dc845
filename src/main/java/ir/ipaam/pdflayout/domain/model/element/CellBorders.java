package ir.ipaam.pdflayout.domain.model.element;

/** Which sides of a table cell carry a border line. */
public record CellBorders(boolean top, boolean left, boolean right, boolean bottom) {
}
