package ir.ipaam.pdflayout.domain.render;

/** A positioned drawing primitive in page coordinates (millimetres, origin top left). */
public sealed interface DrawOperation permits TextRun, LineSegment, Rectangle {
}
