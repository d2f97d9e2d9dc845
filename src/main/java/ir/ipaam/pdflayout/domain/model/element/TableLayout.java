package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.model.style.Color;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows of cells in columns whose widths are proportional to their weights.
 * <pre>
 * TableLayout table = new TableLayout(List.of(2, 1));
 * table.row().element(new Paragraph("Item")).element(new Paragraph("Price")).push();
 * </pre>
 */
public final class TableLayout implements Element {

    private final List<Integer> columnWeights;
    private final List<TableRow> rows = new ArrayList<>();
    private CellDecorator cellDecorator;

    private final int firstRow;
    private final int totalRows;
    private final boolean splitRow;

    public TableLayout(List<Integer> columnWeights) throws LayoutException {
        this(validate(columnWeights), null, 0, -1, false);
    }

    private TableLayout(List<Integer> columnWeights, CellDecorator cellDecorator,
                        int firstRow, int totalRows, boolean splitRow) {
        this.columnWeights = columnWeights;
        this.cellDecorator = cellDecorator;
        this.firstRow = firstRow;
        this.totalRows = totalRows;
        this.splitRow = splitRow;
    }

    public static TableLayout withWeights(int... weights) throws LayoutException {
        List<Integer> list = new ArrayList<>(weights.length);
        for (int weight : weights) {
            list.add(weight);
        }
        return new TableLayout(list);
    }

    private static List<Integer> validate(List<Integer> weights) throws LayoutException {
        if (weights == null || weights.isEmpty()) {
            throw new LayoutException("Table needs at least one column");
        }
        long sum = 0;
        for (Integer weight : weights) {
            if (weight == null || weight < 0) {
                throw new LayoutException("Column weights must not be negative: " + weights);
            }
            sum += weight;
        }
        if (sum == 0) {
            throw new LayoutException("Column weights must not sum to zero: " + weights);
        }
        return List.copyOf(weights);
    }

    /** Starts a new row; it is added by {@link RowBuilder#push()}. */
    public RowBuilder row() {
        return new RowBuilder();
    }

    /**
     * Adds a row.
     *
     * @throws LayoutException if the row does not have one cell per column; the row is not added
     */
    public void push(TableRow row) throws LayoutException {
        if (row.cells().size() != columnWeights.size()) {
            throw new LayoutException("Table row has " + row.cells().size() + " cells but the table has "
                    + columnWeights.size() + " columns");
        }
        rows.add(row);
    }

    public void setCellDecorator(CellDecorator cellDecorator) {
        this.cellDecorator = cellDecorator;
    }

    /**
     * The rows not yet rendered, continuing this table on the next page.
     *
     * @param index    index into {@link #rows()} of the first remaining row
     * @param first    that row, possibly replaced by the remainder of a split row
     * @param splitRow whether {@code first} is the remainder of a split row
     */
    public TableLayout continueAt(int index, TableRow first, boolean splitRow) {
        TableLayout rest = new TableLayout(columnWeights, cellDecorator, firstRow + index, rowCount(), splitRow);
        rest.rows.add(first);
        rest.rows.addAll(rows.subList(index + 1, rows.size()));
        return rest;
    }

    public List<Integer> columnWeights() {
        return columnWeights;
    }

    public int columnCount() {
        return columnWeights.size();
    }

    public List<TableRow> rows() {
        return Collections.unmodifiableList(rows);
    }

    public CellDecorator cellDecorator() {
        return cellDecorator;
    }

    /** Index of the first row of this layout within the original table. */
    public int firstRow() {
        return firstRow;
    }

    /** Number of rows of the original table. */
    public int rowCount() {
        return totalRows < 0 ? rows.size() : totalRows;
    }

    public boolean isSplitRow() {
        return splitRow;
    }

    public final class RowBuilder {

        private final List<Element> cells = new ArrayList<>();
        private Color background;

        private RowBuilder() {
        }

        public RowBuilder element(Element element) {
            cells.add(element);
            return this;
        }

        public RowBuilder setBackgroundColor(Color color) {
            this.background = color;
            return this;
        }

        /**
         * Adds the row to the table.
         *
         * @throws LayoutException if the number of elements differs from the column count
         */
        public void push() throws LayoutException {
            TableLayout.this.push(new TableRow(cells, background));
        }
    }
}
