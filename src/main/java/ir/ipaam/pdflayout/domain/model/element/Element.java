package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.geometry.Margins;
import ir.ipaam.pdflayout.domain.model.style.LineStyle;
import ir.ipaam.pdflayout.domain.model.style.Style;

/**
 * A node of the layout tree.
 * <p>
 * The set of element kinds is closed; the layout engine matches every kind
 * explicitly. Elements are built up front and are not modified while a document
 * is rendered: content that does not fit on a page is carried to the next page
 * as a new element holding only the remainder.
 */
public sealed interface Element
        permits Text, Paragraph, LinearLayout, TableLayout, Break, PageBreak,
        StyledElement, FramedElement, PaddedElement {

    default StyledElement styled(Style style) {
        return new StyledElement(this, style);
    }

    default FramedElement framed(LineStyle lineStyle) {
        return new FramedElement(this, lineStyle);
    }

    default FramedElement framed() {
        return framed(new LineStyle());
    }

    default PaddedElement padded(Margins margins) {
        return new PaddedElement(this, margins);
    }
}
