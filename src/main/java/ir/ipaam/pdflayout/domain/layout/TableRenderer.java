package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.model.element.CellContext;
import ir.ipaam.pdflayout.domain.model.element.CellDecorator;
import ir.ipaam.pdflayout.domain.model.element.Element;
import ir.ipaam.pdflayout.domain.model.element.LinearLayout;
import ir.ipaam.pdflayout.domain.model.element.TableLayout;
import ir.ipaam.pdflayout.domain.model.element.TableRow;
import ir.ipaam.pdflayout.domain.model.geometry.Margins;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.Style;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders tables row by row.
 * <p>
 * Cells are drawn onto a scratch canvas first so the row background, whose
 * height is only known once every cell is rendered, can be painted beneath them.
 * A row in which no cell makes progress is moved to the next page as a whole;
 * otherwise the row is split and the unfinished cells continue on the next page.
 */
class TableRenderer {

    private final LayoutEngine engine;

    TableRenderer(LayoutEngine engine) {
        this.engine = engine;
    }

    RenderOutcome render(TableLayout table, Area area, Style style) throws LayoutException {
        List<TableRow> rows = table.rows();
        double height = 0;

        for (int i = 0; i < rows.size(); i++) {
            TableRow row = rows.get(i);
            boolean continuedRow = i == 0 && table.isSplitRow();
            RowResult result = renderRow(table, row, table.firstRow() + i, i == 0, continuedRow, area, style);

            if (result == null) {
                if (i == 0) {
                    return RenderOutcome.stalled(table);
                }
                return RenderOutcome.continued(new Size(area.width(), height), table.continueAt(i, row, false));
            }

            height += result.height();
            area.addOffset(result.height());
            if (result.remainder() != null) {
                return RenderOutcome.continued(new Size(area.width(), height),
                        table.continueAt(i, result.remainder(), true));
            }
        }
        return RenderOutcome.complete(new Size(rows.isEmpty() ? 0 : area.width(), height));
    }

    /**
     * @return the rendered row, or {@code null} if nothing of the row fits
     */
    private RowResult renderRow(TableLayout table, TableRow row, int rowIndex, boolean firstOnPage,
                                boolean continuedRow, Area area, Style style) throws LayoutException {
        CellDecorator decorator = table.cellDecorator();
        Canvas cellCanvas = new Canvas();
        List<Area> columns = area.onCanvas(cellCanvas).splitHorizontally(table.columnWeights());
        List<Element> cells = row.cells();

        List<CellContext> contexts = new ArrayList<>(cells.size());
        List<Element> remainders = new ArrayList<>(cells.size());
        double rowHeight = 0;
        boolean hasMore = false;
        boolean progress = false;

        for (int column = 0; column < cells.size(); column++) {
            Element cell = cells.get(column);
            CellContext context = new CellContext(column, cells.size(), rowIndex, table.rowCount(),
                    firstOnPage, continuedRow);
            contexts.add(context);
            Margins insets = decorator == null ? Margins.NONE : decorator.prepareCell(context);

            RenderOutcome outcome = engine.render(cell, columns.get(column).inset(insets), style);
            rowHeight = Math.max(rowHeight, outcome.size().height() + insets.vertical());

            if (outcome instanceof RenderOutcome.Continued continued) {
                hasMore = true;
                progress |= !outcome.isStalled(cell);
                remainders.add(continued.continuation());
            } else {
                progress |= !outcome.size().isZero();
                remainders.add(LinearLayout.vertical());
            }
        }

        if (hasMore && !progress) {
            return null;
        }
        rowHeight = Math.min(rowHeight, area.remainingHeight());

        if (row.hasBackground()) {
            area.fillRect(Position.ORIGIN, new Size(area.width(), rowHeight), row.background());
        }
        area.canvas().append(cellCanvas);

        if (decorator != null) {
            List<Area> frames = area.splitHorizontally(table.columnWeights());
            for (int column = 0; column < cells.size(); column++) {
                decorator.decorateCell(contexts.get(column), hasMore, frames.get(column), rowHeight);
            }
        }

        TableRow remainder = hasMore ? new TableRow(remainders, row.background()) : null;
        return new RowResult(rowHeight, remainder);
    }

    private record RowResult(double height, TableRow remainder) {
    }
}
