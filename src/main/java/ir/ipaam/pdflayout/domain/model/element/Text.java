package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.style.Style;

/** A single line of text. It is never wrapped. */
public final class Text implements Element {

    private final StyledString content;

    public Text(String text) {
        this(new StyledString(text, Style.empty()));
    }

    public Text(String text, Style style) {
        this(new StyledString(text, style));
    }

    public Text(StyledString content) {
        this.content = content;
    }

    public StyledString content() {
        return content;
    }
}
