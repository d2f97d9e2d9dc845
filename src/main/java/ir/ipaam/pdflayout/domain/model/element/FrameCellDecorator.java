package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.layout.Area;
import ir.ipaam.pdflayout.domain.model.geometry.Margins;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.style.LineStyle;

/**
 * Draws cell borders, producing a grid.
 * <p>
 * {@code inner} controls the lines between cells, {@code outer} the lines around
 * the table, and {@code continuation} the lines where the table is split by a page
 * break.
 */
public class FrameCellDecorator implements CellDecorator {

    private final boolean inner;
    private final boolean outer;
    private final boolean continuation;
    private final LineStyle lineStyle;

    public FrameCellDecorator(boolean inner, boolean outer, boolean continuation) {
        this(inner, outer, continuation, new LineStyle());
    }

    public FrameCellDecorator(boolean inner, boolean outer, boolean continuation, LineStyle lineStyle) {
        this.inner = inner;
        this.outer = outer;
        this.continuation = continuation;
        this.lineStyle = lineStyle;
    }

    public CellBorders borders(CellContext cell, boolean hasMore) {
        boolean top;
        if (cell.firstOnPage()) {
            top = cell.isFirstRow() && !cell.continued() ? outer : continuation;
        } else {
            top = inner;
        }
        boolean left = cell.isFirstColumn() ? outer : inner;
        boolean right = cell.isLastColumn() && outer;
        boolean bottom = hasMore ? continuation : cell.isLastRow() && outer;
        return new CellBorders(top, left, right, bottom);
    }

    @Override
    public Margins prepareCell(CellContext cell) {
        CellBorders borders = borders(cell, false);
        double t = lineStyle.thickness();
        boolean reserveBottom = borders.bottom() || continuation;
        return new Margins(
                borders.top() ? t : 0,
                borders.right() ? t : 0,
                reserveBottom ? t : 0,
                borders.left() ? t : 0);
    }

    @Override
    public void decorateCell(CellContext cell, boolean hasMore, Area area, double rowHeight) {
        CellBorders borders = borders(cell, hasMore);
        double half = lineStyle.thickness() / 2;
        double width = area.width();

        if (borders.top()) {
            area.drawLine(new Position(0, half), new Position(width, half), lineStyle);
        }
        if (borders.bottom()) {
            area.drawLine(new Position(0, rowHeight - half), new Position(width, rowHeight - half), lineStyle);
        }
        if (borders.left()) {
            area.drawLine(new Position(half, 0), new Position(half, rowHeight), lineStyle);
        }
        if (borders.right()) {
            area.drawLine(new Position(width - half, 0), new Position(width - half, rowHeight), lineStyle);
        }
    }
}
