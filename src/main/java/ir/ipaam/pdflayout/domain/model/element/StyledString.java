package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.style.Style;

import java.util.Objects;

/** A string with the style it is drawn in, relative to the surrounding style. */
public record StyledString(String text, Style style) {

    public StyledString {
        Objects.requireNonNull(text, "text");
        if (style == null) {
            style = Style.empty();
        }
    }

    public static StyledString of(String text) {
        return new StyledString(text, Style.empty());
    }
}
