package ir.ipaam.pdflayout.domain.exception;

/**
 * The element tree cannot be laid out: malformed table rows or weights, or
 * content that does not fit on an empty page.
 */
public class LayoutException extends DocumentException {

    public LayoutException(String message) {
        super(message);
    }
}
