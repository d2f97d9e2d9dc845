package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.geometry.Margins;

import java.util.Objects;

public final class PaddedElement implements Element {

    private final Element element;
    private final Margins padding;

    public PaddedElement(Element element, Margins padding) {
        this.element = Objects.requireNonNull(element, "element");
        this.padding = Objects.requireNonNull(padding, "padding");
    }

    public Element element() {
        return element;
    }

    public Margins padding() {
        return padding;
    }
}
