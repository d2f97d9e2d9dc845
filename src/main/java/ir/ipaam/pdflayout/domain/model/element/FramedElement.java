package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.style.LineStyle;

import java.util.Objects;

/**
 * Draws a frame around the wrapped element. When the content is split across
 * pages, the frame stays open at every split.
 */
public final class FramedElement implements Element {

    private final Element element;
    private final LineStyle lineStyle;
    private final boolean continuation;

    public FramedElement(Element element, LineStyle lineStyle) {
        this(element, lineStyle, false);
    }

    private FramedElement(Element element, LineStyle lineStyle, boolean continuation) {
        this.element = Objects.requireNonNull(element, "element");
        this.lineStyle = lineStyle == null ? new LineStyle() : lineStyle;
        this.continuation = continuation;
    }

    /** Frame around the remainder of the content, open at the top. */
    public FramedElement continueWith(Element remainder) {
        return new FramedElement(remainder, lineStyle, true);
    }

    public Element element() {
        return element;
    }

    public LineStyle lineStyle() {
        return lineStyle;
    }

    public boolean isContinuation() {
        return continuation;
    }
}
