package ir.ipaam.pdflayout.domain.render;

import ir.ipaam.pdflayout.domain.exception.RenderBackendException;
import ir.ipaam.pdflayout.domain.model.geometry.Size;

/**
 * Receives the drawing primitives of a document page by page and serializes them.
 * Calls arrive strictly in page order; every draw call belongs to the page most
 * recently started with {@link #beginPage(Size)}.
 * <p>
 * A backend holds resources until it is closed, whether or not {@link #finish()}
 * was reached. Closing more than once has no effect.
 */
public interface RenderBackend extends AutoCloseable {

    void beginPage(Size pageSize) throws RenderBackendException;

    void drawText(TextRun run) throws RenderBackendException;

    void drawLine(LineSegment line) throws RenderBackendException;

    void drawRect(Rectangle rectangle) throws RenderBackendException;

    /** Completes the document and returns its bytes. */
    byte[] finish() throws RenderBackendException;

    @Override
    void close() throws RenderBackendException;

    default void draw(DrawOperation operation) throws RenderBackendException {
        if (operation instanceof TextRun run) {
            drawText(run);
        } else if (operation instanceof LineSegment line) {
            drawLine(line);
        } else if (operation instanceof Rectangle rectangle) {
            drawRect(rectangle);
        }
    }
}
