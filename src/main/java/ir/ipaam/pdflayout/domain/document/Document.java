package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import ir.ipaam.pdflayout.domain.exception.RenderBackendException;
import ir.ipaam.pdflayout.domain.font.FontBackend;
import ir.ipaam.pdflayout.domain.font.FontFamily;
import ir.ipaam.pdflayout.domain.layout.LayoutEngine;
import ir.ipaam.pdflayout.domain.model.element.Element;
import ir.ipaam.pdflayout.domain.model.element.LinearLayout;
import ir.ipaam.pdflayout.domain.model.geometry.PaperSize;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.Style;
import ir.ipaam.pdflayout.domain.render.PdfBoxRenderBackend;
import ir.ipaam.pdflayout.domain.render.RenderBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A document: root elements plus paper size, default style and page decorator.
 * <pre>
 * Document doc = Document.create(new Standard14FontBackend(), "Helvetica");
 * doc.setPaperSize(PaperSize.A4);
 * doc.setPageDecorator(new SimplePageDecorator(Margins.all(10)));
 * doc.push(new Paragraph("Hello"));
 * byte[] pdf = doc.render();
 * </pre>
 * Configure and fill the document first, then render it once. The element tree
 * must not be changed while rendering.
 */
@Slf4j
public class Document {

    private final FontBackend fontBackend;
    private final List<Element> elements = new ArrayList<>();
    private FontFamily fontFamily;
    private Style style = Style.empty();
    private Size paperSize = PaperSize.A4.size();
    private PageDecorator pageDecorator = new SimplePageDecorator();
    private int renderedPages;

    public Document(FontBackend fontBackend, FontFamily fontFamily) {
        this.fontBackend = Objects.requireNonNull(fontBackend, "fontBackend");
        this.fontFamily = Objects.requireNonNull(fontFamily, "fontFamily");
    }

    /**
     * @throws ConfigurationException if the backend cannot resolve {@code familyName}
     */
    public static Document create(FontBackend fontBackend, String familyName) throws ConfigurationException {
        return new Document(fontBackend, fontBackend.resolveFamily(familyName));
    }

    public void push(Element element) {
        elements.add(Objects.requireNonNull(element, "element"));
    }

    public void setPaperSize(Size paperSize) {
        this.paperSize = Objects.requireNonNull(paperSize, "paperSize");
    }

    public void setPaperSize(PaperSize paperSize) {
        setPaperSize(paperSize.size());
    }

    public void setPageDecorator(PageDecorator pageDecorator) {
        this.pageDecorator = Objects.requireNonNull(pageDecorator, "pageDecorator");
    }

    public void setFontFamily(FontFamily fontFamily) {
        this.fontFamily = Objects.requireNonNull(fontFamily, "fontFamily");
    }

    /** Style applied to all elements, on top of the defaults. */
    public void setStyle(Style style) {
        this.style = style == null ? Style.empty() : style;
    }

    public void setFontSize(int fontSize) {
        this.style = style.withFontSize(fontSize);
    }

    public Size getPaperSize() {
        return paperSize;
    }

    public FontFamily getFontFamily() {
        return fontFamily;
    }

    /** Number of pages produced by the last successful render, or 0. */
    public int getRenderedPages() {
        return renderedPages;
    }

    /** Renders the document as PDF. */
    public byte[] render() throws DocumentException {
        return renderAndClose(new PdfBoxRenderBackend());
    }

    /** Renders to a backend owned by this call; it is closed even when rendering fails. */
    byte[] renderAndClose(RenderBackend backend) throws DocumentException {
        try (backend) {
            return render(backend);
        }
    }

    public void render(OutputStream out) throws DocumentException {
        byte[] bytes = render();
        try {
            out.write(bytes);
        } catch (IOException e) {
            throw new RenderBackendException("Failed to write rendered document", e);
        }
    }

    /**
     * Lays out all elements and sends the pages to {@code backend}. The caller
     * keeps ownership of the backend and closes it.
     *
     * @return the bytes produced by the backend
     * @throws DocumentException if the document cannot be laid out or written; no
     *                           partial document is returned
     */
    public byte[] render(RenderBackend backend) throws DocumentException {
        Style rootStyle = Style.defaults(fontFamily).merge(style);
        LayoutEngine engine = new LayoutEngine(fontBackend);
        PaginationLoop loop = new PaginationLoop(engine, pageDecorator, paperSize, rootStyle);

        int pages = loop.run(LinearLayout.of(elements), backend);
        byte[] bytes = backend.finish();
        renderedPages = pages;
        log.debug("Rendered {} elements on {} pages ({} bytes)", elements.size(), pages, bytes.length);
        return bytes;
    }
}
