package ir.ipaam.pdflayout.domain.model.element;

import ir.ipaam.pdflayout.domain.model.style.Style;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text wrapped to the available width.
 * <p>
 * A paragraph is a sequence of styled runs; appending a run continues the same
 * line, so {@code new Paragraph("A").string("V")} lays out exactly like
 * {@code new Paragraph("AV")}. A newline character forces a line break.
 */
public final class Paragraph implements Element {

    private final List<StyledString> runs = new ArrayList<>();
    private Alignment alignment = Alignment.LEFT;

    public Paragraph() {
    }

    public Paragraph(String text) {
        string(text);
    }

    public Paragraph(StyledString text) {
        push(text);
    }

    /** A paragraph holding the given runs, e.g. the remainder of a wrapped paragraph. */
    public static Paragraph of(List<StyledString> runs, Alignment alignment) {
        Paragraph paragraph = new Paragraph();
        paragraph.runs.addAll(runs);
        paragraph.alignment = alignment;
        return paragraph;
    }

    public Paragraph string(String text) {
        return push(new StyledString(text, Style.empty()));
    }

    public Paragraph styledString(String text, Style style) {
        return push(new StyledString(text, style));
    }

    public Paragraph push(StyledString run) {
        if (!run.text().isEmpty()) {
            runs.add(run);
        }
        return this;
    }

    public Paragraph aligned(Alignment alignment) {
        setAlignment(alignment);
        return this;
    }

    public void setAlignment(Alignment alignment) {
        this.alignment = alignment == null ? Alignment.LEFT : alignment;
    }

    public Alignment alignment() {
        return alignment;
    }

    public List<StyledString> runs() {
        return Collections.unmodifiableList(runs);
    }

    public boolean isEmpty() {
        return runs.isEmpty();
    }
}
