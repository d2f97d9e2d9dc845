package ir.ipaam.pdflayout.domain.font;

import java.util.Objects;

/** Regular, bold, italic and bold italic faces sharing one family name. */
public record FontFamily(String name, Font regular, Font bold, Font italic, Font boldItalic) {

    public FontFamily {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(regular, "regular");
        Objects.requireNonNull(bold, "bold");
        Objects.requireNonNull(italic, "italic");
        Objects.requireNonNull(boldItalic, "boldItalic");
    }

    public Font font(boolean isBold, boolean isItalic) {
        if (isBold && isItalic) {
            return boldItalic;
        }
        if (isBold) {
            return bold;
        }
        return isItalic ? italic : regular;
    }
}
