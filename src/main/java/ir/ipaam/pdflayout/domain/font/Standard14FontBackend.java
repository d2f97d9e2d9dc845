package ir.ipaam.pdflayout.domain.font;

import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.fontbox.afm.AFMParser;
import org.apache.fontbox.afm.CharMetric;
import org.apache.fontbox.afm.FontMetrics;
import org.apache.fontbox.afm.KernPair;
import org.apache.fontbox.util.BoundingBox;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.encoding.GlyphList;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics of the PDF base 14 fonts, read from the AFM files bundled with PDFBox.
 * These families need no font files and are always available.
 */
@Slf4j
public class Standard14FontBackend implements FontBackend {

    public static final String HELVETICA = "Helvetica";
    public static final String TIMES = "Times";
    public static final String COURIER = "Courier";

    private static final String AFM_RESOURCE_DIR = "/org/apache/pdfbox/resources/afm/";

    private static final Map<String, String[]> FAMILIES = Map.of(
            HELVETICA.toLowerCase(Locale.ROOT),
            new String[]{"Helvetica", "Helvetica-Bold", "Helvetica-Oblique", "Helvetica-BoldOblique"},
            TIMES.toLowerCase(Locale.ROOT),
            new String[]{"Times-Roman", "Times-Bold", "Times-Italic", "Times-BoldItalic"},
            COURIER.toLowerCase(Locale.ROOT),
            new String[]{"Courier", "Courier-Bold", "Courier-Oblique", "Courier-BoldOblique"});

    private final Map<String, AfmFace> faces = new ConcurrentHashMap<>();

    @Override
    public FontFamily resolveFamily(String name) throws ConfigurationException {
        String key = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (key.equals("times-roman")) {
            key = TIMES.toLowerCase(Locale.ROOT);
        }
        String[] faceNames = FAMILIES.get(key);
        if (faceNames == null) {
            throw new ConfigurationException("Unknown built-in font family: " + name);
        }
        for (String faceName : faceNames) {
            if (!faces.containsKey(faceName)) {
                faces.put(faceName, loadFace(faceName));
            }
        }
        return new FontFamily(name,
                Font.builtin(faceNames[0]), Font.builtin(faceNames[1]),
                Font.builtin(faceNames[2]), Font.builtin(faceNames[3]));
    }

    public boolean isKnownFamily(String name) {
        return name != null && (FAMILIES.containsKey(name.toLowerCase(Locale.ROOT))
                || name.equalsIgnoreCase("times-roman"));
    }

    @Override
    public double advance(Font font, int codePoint) {
        return face(font).width(glyphName(codePoint));
    }

    @Override
    public double kerning(Font font, int left, int right) {
        return face(font).kerning(glyphName(left), glyphName(right));
    }

    @Override
    public VerticalMetrics verticalMetrics(Font font) {
        return face(font).vertical();
    }

    private AfmFace face(Font font) {
        AfmFace face = faces.get(font.name());
        if (face == null) {
            throw new IllegalArgumentException("Font " + font.name() + " was not resolved by this backend");
        }
        return face;
    }

    private static String glyphName(int codePoint) {
        return GlyphList.getAdobeGlyphList().codePointToName(codePoint);
    }

    private static AfmFace loadFace(String faceName) throws ConfigurationException {
        try (InputStream in = PDType1Font.class.getResourceAsStream(AFM_RESOURCE_DIR + faceName + ".afm")) {
            if (in == null) {
                throw new ConfigurationException("Metrics not found for built-in font: " + faceName);
            }
            FontMetrics metrics = new AFMParser(in).parse();

            Map<String, Double> widths = new HashMap<>();
            for (CharMetric charMetric : metrics.getCharMetrics()) {
                widths.put(charMetric.getName(), (double) charMetric.getWx());
            }
            Map<String, Map<String, Double>> kerning = new HashMap<>();
            for (KernPair pair : metrics.getKernPairs()) {
                kerning.computeIfAbsent(pair.getFirstKernCharacter(), k -> new HashMap<>())
                        .put(pair.getSecondKernCharacter(), (double) pair.getX());
            }
            BoundingBox box = metrics.getFontBBox();
            VerticalMetrics vertical = new VerticalMetrics(box.getUpperRightY(), box.getLowerLeftY(), 0);

            log.debug("Loaded AFM metrics for {} ({} glyphs, {} kerning pairs)",
                    faceName, widths.size(), metrics.getKernPairs().size());
            return new AfmFace(widths, kerning, vertical);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read metrics of built-in font " + faceName, e);
        }
    }

    private record AfmFace(Map<String, Double> widths,
                           Map<String, Map<String, Double>> kerning,
                           VerticalMetrics vertical) {

        double width(String glyph) {
            return widths.getOrDefault(glyph, 0.0);
        }

        double kerning(String left, String right) {
            Map<String, Double> pairs = kerning.get(left);
            return pairs == null ? 0 : pairs.getOrDefault(right, 0.0);
        }
    }
}
