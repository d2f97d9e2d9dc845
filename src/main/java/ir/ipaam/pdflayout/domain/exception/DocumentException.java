package ir.ipaam.pdflayout.domain.exception;

/**
 * Base type of every failure reported by the layout engine.
 * Subclasses tell the caller whether the input, the configuration or the
 * output writer is at fault.
 */
public abstract class DocumentException extends Exception {

    protected DocumentException(String message) {
        super(message);
    }

    protected DocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
