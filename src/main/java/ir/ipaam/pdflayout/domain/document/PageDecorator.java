package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.layout.Area;
import ir.ipaam.pdflayout.domain.model.element.Element;

import java.util.Optional;

/** Prepares every page before its content is rendered. */
public interface PageDecorator {

    /**
     * Returns the area available to the page content, e.g. the page minus its margins.
     *
     * @param pageNumber number of the page, starting at 1
     * @param page       the whole page
     */
    Area decoratePage(int pageNumber, Area page);

    /** Element rendered at the top of the content area of the page, if any. */
    default Optional<Element> header(int pageNumber) {
        return Optional.empty();
    }
}
