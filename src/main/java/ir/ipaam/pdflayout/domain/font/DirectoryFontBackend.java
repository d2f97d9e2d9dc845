package ir.ipaam.pdflayout.domain.font;

import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.fontbox.ttf.CmapLookup;
import org.apache.fontbox.ttf.HorizontalHeaderTable;
import org.apache.fontbox.ttf.KerningSubtable;
import org.apache.fontbox.ttf.KerningTable;
import org.apache.fontbox.ttf.TTFParser;
import org.apache.fontbox.ttf.TrueTypeFont;
import org.apache.pdfbox.io.RandomAccessReadBufferedFile;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads TrueType families from a directory. A family {@code Name} consists of the
 * files {@code Name-Regular.ttf}, {@code Name-Bold.ttf}, {@code Name-Italic.ttf} and
 * {@code Name-BoldItalic.ttf}. When a family is missing and a built-in fallback
 * family is configured, the fallback is used instead.
 */
@Slf4j
public class DirectoryFontBackend implements FontBackend, Closeable {

    private static final String[] SUFFIXES = {"Regular", "Bold", "Italic", "BoldItalic"};

    private final Path directory;
    private final Standard14FontBackend builtin;
    private final String fallbackFamily;
    private final Map<Path, TrueTypeFace> faces = new ConcurrentHashMap<>();

    /**
     * @param directory      directory holding the TrueType files
     * @param builtin        backend used for built-in faces
     * @param fallbackFamily built-in family used when a family has no files, or {@code null}
     */
    public DirectoryFontBackend(Path directory, Standard14FontBackend builtin, String fallbackFamily) {
        this.directory = directory;
        this.builtin = builtin;
        this.fallbackFamily = fallbackFamily;
    }

    @Override
    public FontFamily resolveFamily(String name) throws ConfigurationException {
        Path[] files = new Path[SUFFIXES.length];
        boolean complete = directory != null && Files.isDirectory(directory);
        for (int i = 0; i < SUFFIXES.length && complete; i++) {
            files[i] = directory.resolve(name + "-" + SUFFIXES[i] + ".ttf");
            complete = Files.isRegularFile(files[i]);
        }

        if (!complete) {
            if (builtin.isKnownFamily(name)) {
                return builtin.resolveFamily(name);
            }
            if (fallbackFamily == null) {
                throw new ConfigurationException("Font family " + name + " not found in " + directory);
            }
            log.warn("Font family {} not found in {}, falling back to built-in {}", name, directory, fallbackFamily);
            return builtin.resolveFamily(fallbackFamily);
        }

        Font[] fonts = new Font[SUFFIXES.length];
        for (int i = 0; i < SUFFIXES.length; i++) {
            loadFace(files[i]);
            fonts[i] = new Font(name + "-" + SUFFIXES[i], files[i]);
        }
        log.info("Loaded font family {} from {}", name, directory);
        return new FontFamily(name, fonts[0], fonts[1], fonts[2], fonts[3]);
    }

    @Override
    public double advance(Font font, int codePoint) {
        if (font.isBuiltin()) {
            return builtin.advance(font, codePoint);
        }
        return face(font).advance(codePoint);
    }

    @Override
    public double kerning(Font font, int left, int right) {
        if (font.isBuiltin()) {
            return builtin.kerning(font, left, right);
        }
        return face(font).kerning(left, right);
    }

    @Override
    public VerticalMetrics verticalMetrics(Font font) {
        if (font.isBuiltin()) {
            return builtin.verticalMetrics(font);
        }
        return face(font).vertical();
    }

    @Override
    public void close() throws IOException {
        for (TrueTypeFace face : faces.values()) {
            face.ttf().close();
        }
        faces.clear();
    }

    private synchronized void loadFace(Path file) throws ConfigurationException {
        if (!faces.containsKey(file)) {
            faces.put(file, TrueTypeFace.load(file));
        }
    }

    private TrueTypeFace face(Font font) {
        TrueTypeFace face = faces.get(font.file());
        if (face == null) {
            throw new IllegalArgumentException("Font " + font.name() + " was not resolved by this backend");
        }
        return face;
    }

    private record TrueTypeFace(TrueTypeFont ttf, CmapLookup cmap, KerningSubtable kerning,
                                double scale, VerticalMetrics vertical) {

        static TrueTypeFace load(Path file) throws ConfigurationException {
            try {
                TrueTypeFont ttf = new TTFParser().parse(new RandomAccessReadBufferedFile(file.toFile()));
                double scale = 1000.0 / ttf.getUnitsPerEm();
                KerningTable kerningTable = ttf.getKerning();
                KerningSubtable kerning = kerningTable == null ? null : kerningTable.getHorizontalKerningSubtable();
                HorizontalHeaderTable header = ttf.getHorizontalHeader();
                VerticalMetrics vertical = new VerticalMetrics(
                        header.getAscender() * scale,
                        header.getDescender() * scale,
                        header.getLineGap() * scale);
                return new TrueTypeFace(ttf, ttf.getUnicodeCmapLookup(), kerning, scale, vertical);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load font file " + file, e);
            }
        }

        double advance(int codePoint) {
            try {
                return ttf.getAdvanceWidth(cmap.getGlyphId(codePoint)) * scale;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        double kerning(int left, int right) {
            if (kerning == null) {
                return 0;
            }
            return kerning.getKerning(cmap.getGlyphId(left), cmap.getGlyphId(right)) * scale;
        }
    }
}
