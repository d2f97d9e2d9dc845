package ir.ipaam.pdflayout.domain.exception;

/**
 * The document cannot be rendered as configured, e.g. no usable font family
 * or margins that leave no content area. Raised before any page is produced.
 */
public class ConfigurationException extends DocumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
