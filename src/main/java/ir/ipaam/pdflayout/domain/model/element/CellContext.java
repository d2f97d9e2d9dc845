package ir.ipaam.pdflayout.domain.model.element;

/**
 * Position of a table cell handed to a {@link CellDecorator}.
 *
 * @param column       column index
 * @param columnCount  number of columns
 * @param row          row index within the whole table
 * @param rowCount     number of rows of the whole table
 * @param firstOnPage  the row is the first one of the table on the current page
 * @param continued    the row was split and this is its remainder
 */
public record CellContext(int column, int columnCount, int row, int rowCount,
                          boolean firstOnPage, boolean continued) {

    public boolean isFirstColumn() {
        return column == 0;
    }

    public boolean isLastColumn() {
        return column == columnCount - 1;
    }

    public boolean isFirstRow() {
        return row == 0;
    }

    public boolean isLastRow() {
        return row == rowCount - 1;
    }
}
