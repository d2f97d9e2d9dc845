package ir.ipaam.pdflayout.application.service;

import ir.ipaam.pdflayout.api.dto.BlockRequest;
import ir.ipaam.pdflayout.api.dto.BlockType;
import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.api.dto.RunRequest;
import ir.ipaam.pdflayout.config.LayoutProperties;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import ir.ipaam.pdflayout.domain.font.Standard14FontBackend;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentRenderServiceTest {

    private final LayoutProperties properties = new LayoutProperties();
    private final DocumentRenderService service = new DocumentRenderService(new Standard14FontBackend(), properties);

    private static DocumentRequest request(String... paragraphs) {
        List<BlockRequest> blocks = new ArrayList<>();
        for (String text : paragraphs) {
            BlockRequest block = new BlockRequest();
            block.setType(BlockType.PARAGRAPH);
            block.setRuns(List.of(new RunRequest(text)));
            blocks.add(block);
        }
        DocumentRequest request = new DocumentRequest();
        request.setBlocks(blocks);
        return request;
    }

    @Test
    void rendersRequestWithConfiguredDefaults() throws DocumentException, IOException {
        DocumentRequest request = request("First paragraph", "Second paragraph");
        request.setFileName("report");

        PdfGenerationResult result = service.render(request);

        assertThat(result.fileName()).isEqualTo("report.pdf");
        assertThat(result.pageCount()).isEqualTo(1);
        try (PDDocument loaded = Loader.loadPDF(result.pdfBytes())) {
            assertThat(loaded.getPage(0).getMediaBox().getWidth()).isCloseTo(595.3f, within(0.1f));
            assertThat(new PDFTextStripper().getText(loaded)).contains("First paragraph").contains("Second paragraph");
        }
    }

    @Test
    void generatesFileNameWhenMissing() throws DocumentException {
        PdfGenerationResult result = service.render(request("x"));

        assertThat(result.fileName()).endsWith(".pdf").hasSizeGreaterThan(".pdf".length());
    }

    @Test
    void headerTextIsPrintedFromSecondPage() throws DocumentException, IOException {
        String[] paragraphs = new String[120];
        for (int i = 0; i < paragraphs.length; i++) {
            paragraphs[i] = "Paragraph " + i;
        }
        DocumentRequest request = request(paragraphs);
        request.setHeaderText("Report page");

        PdfGenerationResult result = service.render(request);

        assertThat(result.pageCount()).isGreaterThan(1);
        try (PDDocument loaded = Loader.loadPDF(result.pdfBytes())) {
            assertThat(new PDFTextStripper().getText(loaded))
                    .contains("Report page 2")
                    .doesNotContain("Report page 1");
        }
    }

    @Test
    void unknownFontFamilyIsConfigurationError() {
        DocumentRequest request = request("x");
        request.setFontFamily("Wingdings");

        assertThrows(ConfigurationException.class, () -> service.render(request));
    }

    @Test
    void requestMarginsOverrideDefaults() {
        properties.setMargins(10);
        DocumentRequest request = request("x");
        request.setMargins(150.0);

        assertThrows(ConfigurationException.class, () -> service.render(request));
    }
}
