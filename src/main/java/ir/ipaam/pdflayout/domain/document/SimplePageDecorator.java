package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.layout.Area;
import ir.ipaam.pdflayout.domain.model.element.Element;
import ir.ipaam.pdflayout.domain.model.geometry.Margins;

import java.util.Optional;

/** Page decorator with fixed margins and an optional header. */
public class SimplePageDecorator implements PageDecorator {

    private Margins margins = Margins.NONE;
    private PageHeader header;

    public SimplePageDecorator() {
    }

    public SimplePageDecorator(Margins margins) {
        setMargins(margins);
    }

    public void setMargins(Margins margins) {
        this.margins = margins == null ? Margins.NONE : margins;
    }

    public void setMargins(double margins) {
        setMargins(Margins.all(margins));
    }

    public Margins getMargins() {
        return margins;
    }

    public void setHeader(PageHeader header) {
        this.header = header;
    }

    @Override
    public Area decoratePage(int pageNumber, Area page) {
        return page.inset(margins);
    }

    @Override
    public Optional<Element> header(int pageNumber) {
        return header == null ? Optional.empty() : Optional.ofNullable(header.header(pageNumber));
    }
}
