package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.model.element.Element;

/** Creates the header of a page. */
@FunctionalInterface
public interface PageHeader {

    /**
     * @param pageNumber number of the page, starting at 1
     * @return the header element, or {@code null} for no header on this page
     */
    Element header(int pageNumber);
}
