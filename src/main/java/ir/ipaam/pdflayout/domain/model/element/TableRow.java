package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.style.Color;

import java.util.List;

/**
 * One row of a {@link TableLayout}.
 *
 * @param cells      one element per column
 * @param background fill painted behind the whole row, or {@code null}
 */
public record TableRow(List<Element> cells, Color background) {

    public TableRow {
        cells = List.copyOf(cells);
    }

    public boolean hasBackground() {
        return background != null;
    }
}
