package ir.ipaam.pdflayout.domain.render;

import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.style.LineStyle;

public record LineSegment(Position start, Position end, LineStyle style) implements DrawOperation {
}
