package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.layout.Area;
import ir.ipaam.pdflayout.domain.layout.Canvas;
import ir.ipaam.pdflayout.domain.layout.LayoutEngine;
import ir.ipaam.pdflayout.domain.layout.RenderOutcome;
import ir.ipaam.pdflayout.domain.model.element.Element;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.Style;
import ir.ipaam.pdflayout.domain.render.DrawOperation;
import ir.ipaam.pdflayout.domain.render.RenderBackend;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Drives an element tree over as many pages as it needs.
 * <p>
 * Each page starts with a fresh content area from the page decorator. The header
 * is rendered first, then the content; whatever did not fit is carried to the
 * next page. Content is never moved once placed on a page. A page on which the
 * content places nothing at all ends the loop with a {@link LayoutException},
 * since every following page would look the same.
 */
@Slf4j
class PaginationLoop {

    private final LayoutEngine engine;
    private final PageDecorator decorator;
    private final Size paperSize;
    private final Style rootStyle;

    private PageState state = PageState.AWAITING_PAGE;
    private int pageNumber = 1;

    PaginationLoop(LayoutEngine engine, PageDecorator decorator, Size paperSize, Style rootStyle) {
        this.engine = engine;
        this.decorator = decorator;
        this.paperSize = paperSize;
        this.rootStyle = rootStyle;
    }

    /** Renders {@code content} and returns the number of pages produced. */
    int run(Element content, RenderBackend backend) throws DocumentException {
        Element remaining = content;
        while (true) {
            transition(PageState.AWAITING_PAGE);
            Canvas canvas = new Canvas();
            Area area = contentArea(canvas);

            Optional<Element> header = decorator.header(pageNumber);
            if (header.isPresent()) {
                RenderOutcome outcome = engine.render(header.get(), area, rootStyle);
                if (!outcome.isComplete()) {
                    throw new LayoutException("Header of page " + pageNumber + " does not fit on the page");
                }
                area.addOffset(outcome.size().height());
            }
            transition(PageState.HEADER_DRAWN);

            transition(PageState.CONTENT_RENDERING);
            RenderOutcome outcome = engine.render(remaining, area, rootStyle);
            if (outcome.isStalled(remaining)) {
                throw new LayoutException("Content does not fit on empty page " + pageNumber);
            }

            backend.beginPage(paperSize);
            for (DrawOperation operation : canvas.operations()) {
                backend.draw(operation);
            }
            transition(PageState.PAGE_COMPLETE);

            if (outcome instanceof RenderOutcome.Continued continued) {
                remaining = continued.continuation();
                pageNumber++;
            } else {
                return pageNumber;
            }
        }
    }

    PageState state() {
        return state;
    }

    private Area contentArea(Canvas canvas) throws ConfigurationException {
        Area page = new Area(canvas, Position.ORIGIN, paperSize);
        Area area = decorator.decoratePage(pageNumber, page);
        if (area.width() <= 0 || area.remainingHeight() <= 0) {
            throw new ConfigurationException(String.format(
                    "Page margins leave no content area on page %d (%.2f x %.2f mm)",
                    pageNumber, area.width(), area.remainingHeight()));
        }
        return area;
    }

    private void transition(PageState next) {
        log.debug("Page {}: {} -> {}", pageNumber, state, next);
        state = next;
    }
}
