package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.style.Style;

import java.util.Objects;

/** Applies a style to every descendant of the wrapped element. */
public final class StyledElement implements Element {

    private final Element element;
    private final Style style;

    public StyledElement(Element element, Style style) {
        this.element = Objects.requireNonNull(element, "element");
        this.style = style == null ? Style.empty() : style;
    }

    public Element element() {
        return element;
    }

    public Style style() {
        return style;
    }
}
