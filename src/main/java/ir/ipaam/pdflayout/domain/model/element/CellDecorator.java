package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.layout.Area;
import ir.ipaam.pdflayout.domain.model.geometry.Margins;

/**
 * Policy for decorating table cells, called once per cell and page.
 */
public interface CellDecorator {

    /** Space to keep free around the cell content. */
    Margins prepareCell(CellContext cell);

    /**
     * Draws the decoration of a rendered cell.
     *
     * @param hasMore   the row continues on the next page
     * @param area      the full cell area, including the prepared margins
     * @param rowHeight height of the row on this page
     */
    void decorateCell(CellContext cell, boolean hasMore, Area area, double rowHeight);
}
