package ir.ipaam.pdflayout.domain.document;

/**
 * States a page passes through while a document is rendered. After
 * {@link #PAGE_COMPLETE} the loop either stops or awaits the next page.
 */
public enum PageState {
    AWAITING_PAGE,
    HEADER_DRAWN,
    CONTENT_RENDERING,
    PAGE_COMPLETE
}
