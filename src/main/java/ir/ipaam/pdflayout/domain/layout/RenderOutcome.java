package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.model.element.Element;
import ir.ipaam.pdflayout.domain.model.geometry.Size;

/** Result of rendering an element into an area. */
public sealed interface RenderOutcome permits RenderOutcome.Complete, RenderOutcome.Continued {

    /** Space used in the area. */
    Size size();

    /** Everything was rendered. */
    record Complete(Size size) implements RenderOutcome {
    }

    /**
     * The area ran out of space.
     *
     * @param continuation the content not rendered yet, to be rendered on the next page
     */
    record Continued(Size size, Element continuation) implements RenderOutcome {
    }

    static Complete complete(Size size) {
        return new Complete(size);
    }

    static Continued continued(Size size, Element continuation) {
        return new Continued(size, continuation);
    }

    /** Nothing of {@code element} could be rendered. */
    static Continued stalled(Element element) {
        return new Continued(Size.ZERO, element);
    }

    default boolean isComplete() {
        return this instanceof Complete;
    }

    /** Whether rendering {@code element} produced this outcome without placing anything. */
    default boolean isStalled(Element element) {
        return this instanceof Continued continued && continued.continuation() == element;
    }
}
