package ir.ipaam.pdflayout.domain.render;

import ir.ipaam.pdflayout.domain.exception.RenderBackendException;
import ir.ipaam.pdflayout.domain.font.Font;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.geometry.Units;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the drawing primitives into a PDF document with PDFBox.
 * Built-in fonts are referenced as base 14 fonts, TrueType fonts are embedded as subsets.
 * An instance produces exactly one document.
 */
@Slf4j
public class PdfBoxRenderBackend implements RenderBackend {

    private final PDDocument document = new PDDocument();
    private final Map<Font, PDFont> fonts = new HashMap<>();

    private PDPageContentStream content;
    private float pageHeight;
    private int pageCount;
    private boolean closed;

    @Override
    public void beginPage(Size pageSize) throws RenderBackendException {
        try {
            closeContent();
            PDPage page = new PDPage(new PDRectangle(
                    (float) Units.mmToPt(pageSize.width()),
                    (float) Units.mmToPt(pageSize.height())));
            document.addPage(page);
            pageHeight = page.getMediaBox().getHeight();
            content = new PDPageContentStream(document, page);
            pageCount++;
        } catch (IOException e) {
            throw new RenderBackendException("Failed to start page " + (pageCount + 1), e);
        }
    }

    @Override
    public void drawText(TextRun run) throws RenderBackendException {
        try {
            PDFont font = pdFont(run.font());
            content.beginText();
            content.setFont(font, run.fontSize());
            content.setNonStrokingColor(run.color().toAwtColor());
            content.newLineAtOffset(x(run.baseline()), y(run.baseline()));
            if (run.isKerned()) {
                content.showTextWithPositioning(positioned(run));
            } else {
                content.showText(run.text());
            }
            content.endText();
        } catch (IOException | IllegalArgumentException e) {
            throw new RenderBackendException("Failed to draw text '" + run.text() + "' on page " + pageCount, e);
        }
    }

    @Override
    public void drawLine(LineSegment line) throws RenderBackendException {
        try {
            content.setStrokingColor(line.style().color().toAwtColor());
            content.setLineWidth((float) Units.mmToPt(line.style().thickness()));
            content.moveTo(x(line.start()), y(line.start()));
            content.lineTo(x(line.end()), y(line.end()));
            content.stroke();
        } catch (IOException e) {
            throw new RenderBackendException("Failed to draw line on page " + pageCount, e);
        }
    }

    @Override
    public void drawRect(Rectangle rectangle) throws RenderBackendException {
        try {
            Position topLeft = rectangle.topLeft();
            float width = (float) Units.mmToPt(rectangle.size().width());
            float height = (float) Units.mmToPt(rectangle.size().height());
            content.setNonStrokingColor(rectangle.fill().toAwtColor());
            content.addRect(x(topLeft), y(topLeft) - height, width, height);
            content.fill();
        } catch (IOException e) {
            throw new RenderBackendException("Failed to draw rectangle on page " + pageCount, e);
        }
    }

    @Override
    public byte[] finish() throws RenderBackendException {
        if (closed) {
            throw new RenderBackendException("PDF document already closed", new IllegalStateException());
        }
        byte[] bytes;
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            closeContent();
            document.save(out);
            bytes = out.toByteArray();
        } catch (IOException e) {
            RenderBackendException failure = new RenderBackendException("Failed to write PDF document", e);
            try {
                close();
            } catch (RenderBackendException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
        close();
        log.debug("Serialized PDF with {} pages", pageCount);
        return bytes;
    }

    @Override
    public void close() throws RenderBackendException {
        if (closed) {
            return;
        }
        closed = true;
        try (PDDocument doc = document) {
            closeContent();
        } catch (IOException e) {
            throw new RenderBackendException("Failed to release PDF document", e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void closeContent() throws IOException {
        if (content != null) {
            content.close();
            content = null;
        }
    }

    private PDFont pdFont(Font font) throws IOException {
        PDFont pdFont = fonts.get(font);
        if (pdFont == null) {
            pdFont = font.isBuiltin()
                    ? new PDType1Font(standard14(font.name()))
                    : PDType0Font.load(document, font.file().toFile());
            fonts.put(font, pdFont);
        }
        return pdFont;
    }

    private static Standard14Fonts.FontName standard14(String name) {
        for (Standard14Fonts.FontName fontName : Standard14Fonts.FontName.values()) {
            if (fontName.getName().equals(name)) {
                return fontName;
            }
        }
        throw new IllegalArgumentException("Not a base 14 font: " + name);
    }

    /** Splits the run at every kerned glyph pair into a TJ array. */
    private static Object[] positioned(TextRun run) {
        List<Object> parts = new ArrayList<>();
        int[] codePoints = run.text().codePoints().toArray();
        StringBuilder segment = new StringBuilder();
        for (int i = 0; i < codePoints.length; i++) {
            segment.appendCodePoint(codePoints[i]);
            if (i < run.kerning().size() && run.kerning().get(i) != 0) {
                parts.add(segment.toString());
                // TJ offsets are subtracted from the advance
                parts.add((float) -run.kerning().get(i));
                segment.setLength(0);
            }
        }
        if (segment.length() > 0) {
            parts.add(segment.toString());
        }
        return parts.toArray();
    }

    private float x(Position position) {
        return (float) Units.mmToPt(position.x());
    }

    private float y(Position position) {
        return pageHeight - (float) Units.mmToPt(position.y());
    }
}
