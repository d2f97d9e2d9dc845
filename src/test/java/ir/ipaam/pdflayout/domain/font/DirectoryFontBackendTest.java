package ir.ipaam.pdflayout.domain.font;

import ir.ipaam.pdflayout.domain.document.Document;
import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import ir.ipaam.pdflayout.domain.model.element.Paragraph;
import ir.ipaam.pdflayout.domain.model.element.Text;
import ir.ipaam.pdflayout.domain.model.style.Style;
import ir.ipaam.pdflayout.domain.render.TextRun;
import ir.ipaam.pdflayout.support.RecordingRenderBackend;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DirectoryFontBackendTest {

    private static final String LIBERATION_SANS = "/org/apache/pdfbox/resources/ttf/LiberationSans-Regular.ttf";

    @TempDir
    Path fonts;

    /** Installs the TrueType font shipped with PDFBox as all four faces of {@code family}. */
    private void installFamily(String family) throws IOException {
        for (String suffix : List.of("Regular", "Bold", "Italic", "BoldItalic")) {
            try (InputStream in = getClass().getResourceAsStream(LIBERATION_SANS)) {
                assertNotNull(in, "PDFBox should bundle " + LIBERATION_SANS);
                Files.copy(in, fonts.resolve(family + "-" + suffix + ".ttf"));
            }
        }
    }

    @Test
    void builtinFamilyNeedsNoFiles() throws ConfigurationException, IOException {
        try (DirectoryFontBackend backend = new DirectoryFontBackend(fonts, new Standard14FontBackend(), null)) {
            FontFamily family = backend.resolveFamily("Courier");

            assertThat(family.regular().isBuiltin()).isTrue();
            assertThat(backend.advance(family.regular(), 'i')).isEqualTo(600.0);
        }
    }

    @Test
    void missingFamilyFallsBackToConfiguredFamily() throws ConfigurationException, IOException {
        try (DirectoryFontBackend backend =
                     new DirectoryFontBackend(fonts, new Standard14FontBackend(), "Helvetica")) {
            FontFamily family = backend.resolveFamily("NotoSans");

            assertThat(family.regular().name()).isEqualTo("Helvetica");
        }
    }

    @Test
    void incompleteFamilyIsTreatedAsMissing() throws IOException {
        Files.createFile(fonts.resolve("NotoSans-Regular.ttf"));
        try (DirectoryFontBackend backend = new DirectoryFontBackend(fonts, new Standard14FontBackend(), null)) {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> backend.resolveFamily("NotoSans"));

            assertThat(e.getMessage()).contains("NotoSans");
        }
    }

    @Test
    void trueTypeMetricsAreReadFromFile() throws ConfigurationException, IOException {
        installFamily("X");
        try (DirectoryFontBackend backend = new DirectoryFontBackend(fonts, new Standard14FontBackend(), null)) {
            FontFamily family = backend.resolveFamily("X");
            Font regular = family.regular();

            assertThat(regular.isBuiltin()).isFalse();
            assertThat(regular.name()).isEqualTo("X-Regular");
            assertThat(regular.file()).isEqualTo(fonts.resolve("X-Regular.ttf"));
            assertThat(backend.advance(regular, 'A')).isCloseTo(667.0, within(0.5));
            assertThat(backend.kerning(regular, 'A', 'V')).isCloseTo(-74.2, within(0.05));

            VerticalMetrics metrics = backend.verticalMetrics(regular);
            assertThat(metrics.ascent()).isPositive();
            assertThat(metrics.descent()).isNegative();
        }
    }

    @Test
    void resolvingFamilyTwiceReusesLoadedFaces() throws ConfigurationException, IOException {
        installFamily("X");
        try (DirectoryFontBackend backend = new DirectoryFontBackend(fonts, new Standard14FontBackend(), null)) {
            FontFamily first = backend.resolveFamily("X");
            FontFamily second = backend.resolveFamily("X");

            assertThat(second.bold()).isEqualTo(first.bold());
            assertThat(backend.advance(second.bold(), 'A')).isEqualTo(backend.advance(first.bold(), 'A'));
        }
    }

    @Test
    void concurrentResolutionSharesOneBackend() throws Exception {
        installFamily("X");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try (DirectoryFontBackend backend = new DirectoryFontBackend(fonts, new Standard14FontBackend(), null)) {
            List<Callable<FontFamily>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> backend.resolveFamily("X"));
            }

            List<FontFamily> families = new ArrayList<>();
            for (Future<FontFamily> future : executor.invokeAll(tasks)) {
                families.add(future.get());
            }

            assertThat(families).allMatch(family -> family.equals(families.get(0)));
            assertThat(backend.kerning(families.get(0).regular(), 'A', 'V')).isCloseTo(-74.2, within(0.05));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void kernedRunsCarryTrueTypeAdjustments() throws DocumentException, IOException {
        installFamily("X");
        try (DirectoryFontBackend backend = new DirectoryFontBackend(fonts, new Standard14FontBackend(), null)) {
            Document document = Document.create(backend, "X");
            document.push(new Text("AVATAR"));
            RecordingRenderBackend recording = new RecordingRenderBackend();

            document.render(recording);

            TextRun run = recording.texts(0).get(0);
            assertThat(run.isKerned()).isTrue();
            assertThat(run.kerning().get(0)).isCloseTo(-74.2, within(0.05));
        }
    }

    @Test
    void trueTypeFontIsEmbeddedInPdf() throws DocumentException, IOException {
        installFamily("X");
        try (DirectoryFontBackend backend = new DirectoryFontBackend(fonts, new Standard14FontBackend(), null)) {
            Document document = Document.create(backend, "X");
            document.push(new Paragraph("AVATAR kerned").styledString(" and bold", Style.empty().bold()));

            byte[] pdf = document.render();

            try (PDDocument loaded = Loader.loadPDF(pdf)) {
                String text = new PDFTextStripper().getText(loaded);
                assertThat(text).contains("AVATAR kerned and bold");

                PDResources resources = loaded.getPage(0).getResources();
                List<String> fontNames = new ArrayList<>();
                for (COSName name : resources.getFontNames()) {
                    fontNames.add(resources.getFont(name).getName());
                }
                assertThat(fontNames).isNotEmpty().allMatch(name -> name.contains("LiberationSans"));
            }
        }
    }
}
