package ir.ipaam.pdflayout.domain.exception;

public class RenderBackendException extends DocumentException {

    public RenderBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
