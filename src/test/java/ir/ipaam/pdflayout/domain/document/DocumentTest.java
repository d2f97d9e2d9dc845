package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.model.element.LinearLayout;
import ir.ipaam.pdflayout.domain.model.element.PageBreak;
import ir.ipaam.pdflayout.domain.model.element.Paragraph;
import ir.ipaam.pdflayout.domain.model.element.Text;
import ir.ipaam.pdflayout.domain.model.geometry.Margins;
import ir.ipaam.pdflayout.domain.model.geometry.PaperSize;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.Style;
import ir.ipaam.pdflayout.domain.render.LineSegment;
import ir.ipaam.pdflayout.domain.render.TextRun;
import ir.ipaam.pdflayout.support.FixedMetricsFontBackend;
import ir.ipaam.pdflayout.support.RecordingRenderBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static ir.ipaam.pdflayout.support.FixedMetricsFontBackend.mm;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentTest {

    private static final double LINE = mm(1000, 12);

    private final RecordingRenderBackend backend = new RecordingRenderBackend();
    private Document document;

    @BeforeEach
    void setUp() throws ConfigurationException {
        document = Document.create(new FixedMetricsFontBackend(), FixedMetricsFontBackend.FAMILY);
    }

    @Test
    void singleParagraphFitsOnOnePage() throws DocumentException {
        document.setPaperSize(PaperSize.A4);
        document.setPageDecorator(new SimplePageDecorator(Margins.all(10)));
        document.push(new Paragraph("Hello world"));

        byte[] bytes = document.render(backend);

        assertThat(bytes).isNotEmpty();
        assertThat(backend.isFinished()).isTrue();
        assertThat(backend.pageCount()).isEqualTo(1);
        assertThat(backend.pageSizes()).containsExactly(new Size(210, 297));
        TextRun run = backend.texts(0).get(0);
        assertThat(run.text()).isEqualTo("Hello world");
        assertThat(run.baseline().x()).isEqualTo(10.0);
        assertThat(document.getRenderedPages()).isEqualTo(1);
    }

    @Test
    void contentFlowsOverAsManyPagesAsNeeded() throws DocumentException {
        document.setPaperSize(new Size(100, 10 * LINE));
        for (int i = 0; i < 25; i++) {
            document.push(new Text("line " + i));
        }

        document.render(backend);

        assertThat(backend.pageCount()).isEqualTo(3);
        assertThat(backend.textOf(0)).hasSize(10).startsWith("line 0");
        assertThat(backend.textOf(1)).hasSize(10).startsWith("line 10");
        assertThat(backend.textOf(2)).containsExactly("line 20", "line 21", "line 22", "line 23", "line 24");
        assertThat(document.getRenderedPages()).isEqualTo(3);
    }

    @Test
    void longParagraphIsWrappedAcrossPages() throws DocumentException {
        document.setPaperSize(new Size(60, 5 * LINE));
        document.push(new Paragraph("word ".repeat(60)));

        document.render(backend);

        assertThat(backend.pageCount()).isGreaterThan(1);
        List<String> all = new ArrayList<>();
        for (int page = 0; page < backend.pageCount(); page++) {
            all.addAll(backend.textOf(page));
        }
        assertThat(String.join(" ", all).split(" ")).hasSize(60);
    }

    @Test
    void elementThatCanNeverFitFailsInsteadOfLooping() {
        document.setPaperSize(new Size(100, LINE / 2));
        document.push(new Text("a"));

        LayoutException e = assertThrows(LayoutException.class, () -> document.render(backend));

        assertThat(e.getMessage()).contains("page 1");
        assertThat(backend.isFinished()).isFalse();
    }

    @Test
    void elementThatStopsFittingOnLaterPageFails() {
        document.setPaperSize(new Size(100, 3 * LINE));
        document.push(new Text("a"));
        document.push(new Text("b"));
        document.push(new Text("c"));
        document.push(new Text("d").styled(Style.empty().withFontSize(48)));

        LayoutException e = assertThrows(LayoutException.class, () -> document.render(backend));

        assertThat(e.getMessage()).contains("page 2");
        assertThat(backend.pageCount()).isEqualTo(1);
    }

    @Test
    void ownedBackendIsClosedWhenLayoutFails() {
        document.setPaperSize(new Size(100, 3 * LINE));
        document.push(new Text("a"));
        document.push(new Text("b"));
        document.push(new Text("c"));
        document.push(new Text("d"));
        document.push(new Paragraph("x".repeat(200)));

        assertThrows(LayoutException.class, () -> document.renderAndClose(backend));

        assertThat(backend.pageCount()).isEqualTo(1);
        assertThat(backend.isFinished()).isFalse();
        assertThat(backend.isClosed()).isTrue();
    }

    @Test
    void ownedBackendIsClosedAfterRendering() throws DocumentException {
        document.push(new Text("a"));

        document.renderAndClose(backend);

        assertThat(backend.isFinished()).isTrue();
        assertThat(backend.isClosed()).isTrue();
    }

    @Test
    void callerKeepsOwnershipOfPassedBackend() throws DocumentException {
        document.push(new Text("a"));

        document.render(backend);

        assertThat(backend.isClosed()).isFalse();
    }

    @Test
    void wideWordFailsRendering() {
        document.setPaperSize(new Size(10, 100));
        document.push(new Paragraph("unbreakable"));

        assertThrows(LayoutException.class, () -> document.render(backend));
    }

    @Test
    void marginsLeavingNoRoomAreConfigurationError() {
        document.setPaperSize(new Size(100, 100));
        document.setPageDecorator(new SimplePageDecorator(Margins.all(50)));
        document.push(new Text("a"));

        assertThrows(ConfigurationException.class, () -> document.render(backend));
        assertThat(backend.pageCount()).isZero();
    }

    @Test
    void headerIsRequestedForEveryPageInOrder() throws DocumentException {
        List<Integer> requested = new ArrayList<>();
        SimplePageDecorator decorator = new SimplePageDecorator();
        decorator.setHeader(page -> {
            requested.add(page);
            return page > 1 ? new Text("Page " + page) : null;
        });
        document.setPageDecorator(decorator);
        document.setPaperSize(new Size(100, 4 * LINE));
        for (int i = 0; i < 10; i++) {
            document.push(new Text("line " + i));
        }

        document.render(backend);

        assertThat(requested).containsExactly(1, 2, 3);
        assertThat(backend.textOf(0)).doesNotContain("Page 1").hasSize(4);
        assertThat(backend.textOf(1)).startsWith("Page 2").hasSize(4);
        assertThat(backend.textOf(2)).startsWith("Page 3");
        assertThat(backend.texts(1).get(1).baseline().y())
                .isCloseTo(LINE + mm(800, 12), within(1e-9));
    }

    @Test
    void headerTallerThanPageFails() {
        SimplePageDecorator decorator = new SimplePageDecorator();
        decorator.setHeader(page -> LinearLayout.vertical()
                .element(new Text("a")).element(new Text("b")).element(new Text("c")));
        document.setPageDecorator(decorator);
        document.setPaperSize(new Size(100, 2 * LINE + 1));
        document.push(new Text("content"));

        LayoutException e = assertThrows(LayoutException.class, () -> document.render(backend));

        assertThat(e.getMessage()).contains("Header");
    }

    @Test
    void pageBreakStartsNewPage() throws DocumentException {
        document.push(new Text("before"));
        document.push(new PageBreak());
        document.push(new Text("after"));

        document.render(backend);

        assertThat(backend.pageCount()).isEqualTo(2);
        assertThat(backend.textOf(0)).containsExactly("before");
        assertThat(backend.textOf(1)).containsExactly("after");
    }

    @Test
    void emptyDocumentHasOneBlankPage() throws DocumentException {
        document.render(backend);

        assertThat(backend.pageCount()).isEqualTo(1);
        assertThat(backend.page(0)).isEmpty();
    }

    @Test
    void documentStyleIsInheritedByElements() throws DocumentException {
        document.setFontSize(20);
        document.push(new Paragraph("big"));

        document.render(backend);

        assertThat(backend.texts(0).get(0).fontSize()).isEqualTo(20);
    }

    @Test
    void framedParagraphOnSmallPageIsClosed() throws DocumentException {
        document.setPaperSize(new Size(100, 30));
        document.setPageDecorator(new SimplePageDecorator(Margins.all(5)));
        document.push(new Paragraph("Lorem ipsum").framed());

        document.render(backend);

        assertThat(backend.pageCount()).isEqualTo(1);
        assertThat(backend.lines(0)).hasSize(4);
        assertThat(horizontalLines(0)).hasSize(2);
    }

    @Test
    void framedParagraphOverSeveralPagesIsOpenAtPageBoundaries() throws DocumentException {
        document.setPaperSize(new Size(100, 30));
        document.setPageDecorator(new SimplePageDecorator(Margins.all(5)));
        document.push(new Paragraph("Lorem ipsum dolor sit amet, consectetur adipiscing elit. ".repeat(9)).framed());

        document.render(backend);

        int last = backend.pageCount() - 1;
        assertThat(last).isGreaterThan(1);
        assertThat(horizontalLines(0)).hasSize(1);
        assertThat(horizontalLines(0).get(0).start().y()).isCloseTo(5.05, within(1e-9));
        for (int page = 1; page < last; page++) {
            assertThat(backend.lines(page)).hasSize(2);
            assertThat(horizontalLines(page)).isEmpty();
        }
        assertThat(horizontalLines(last)).hasSize(1);
        assertThat(backend.lines(last)).hasSize(3);
    }

    private List<LineSegment> horizontalLines(int page) {
        return backend.lines(page).stream()
                .filter(line -> line.start().y() == line.end().y())
                .collect(Collectors.toList());
    }

    @Test
    void unknownFontFamilyIsConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> Document.create(new FixedMetricsFontBackend(), "Missing"));
    }
}
