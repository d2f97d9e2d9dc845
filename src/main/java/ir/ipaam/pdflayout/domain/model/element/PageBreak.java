package ir.ipaam.pdflayout.domain.model.element;

/** Moves all following content to the next page. */
public final class PageBreak implements Element {

    private final boolean taken;

    public PageBreak() {
        this(false);
    }

    private PageBreak(boolean taken) {
        this.taken = taken;
    }

    /** The break after it has ended a page; it renders as nothing. */
    public PageBreak taken() {
        return new PageBreak(true);
    }

    public boolean isTaken() {
        return taken;
    }
}
