package ir.ipaam.pdflayout.domain.render;

import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.Color;

import java.util.Objects;

/**
 * An axis aligned rectangle filled with {@code fill}.
 */
public record Rectangle(Position topLeft, Size size, Color fill) implements DrawOperation {

    public Rectangle {
        Objects.requireNonNull(fill, "fill");
    }

    public static Rectangle filled(Position topLeft, Size size, Color fill) {
        return new Rectangle(topLeft, size, fill);
    }
}
