package ir.ipaam.pdflayout.domain.font;

import java.nio.file.Path;

/**
 * A single font face.
 *
 * @param name PostScript name of the face; for built-in faces one of the PDF base 14 names
 * @param file TrueType file backing the face, or {@code null} for a built-in face
 */
public record Font(String name, Path file) {

    public static Font builtin(String name) {
        return new Font(name, null);
    }

    public boolean isBuiltin() {
        return file == null;
    }
}
