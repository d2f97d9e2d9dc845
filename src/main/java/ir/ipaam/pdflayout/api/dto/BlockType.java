package ir.ipaam.pdflayout.api.dto;

public enum BlockType {
    PARAGRAPH,
    BREAK,
    PAGE_BREAK,
    TABLE
}
