package ir.ipaam.pdflayout.config;

import ir.ipaam.pdflayout.domain.model.geometry.PaperSize;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/** Defaults for documents rendered by the service, bound from {@code layout.*}. */
@Getter
@Setter
@ConfigurationProperties(prefix = "layout")
public class LayoutProperties {

    private PaperSize paperSize = PaperSize.A4;

    /** Page margins in millimetres. */
    private double margins = 10;

    private String fontFamily = "Helvetica";

    private int fontSize = 11;

    /**
     * Directory with {@code <Family>-Regular.ttf}, {@code -Bold}, {@code -Italic} and
     * {@code -BoldItalic} files. When unset only the built-in PDF fonts are available.
     */
    private Path fontDirectory;
}
