package ir.ipaam.pdflayout.api.mapper;

import ir.ipaam.pdflayout.api.dto.BlockRequest;
import ir.ipaam.pdflayout.api.dto.ColorRequest;
import ir.ipaam.pdflayout.api.dto.RowRequest;
import ir.ipaam.pdflayout.api.dto.RunRequest;
import ir.ipaam.pdflayout.domain.document.PageHeader;
import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.model.element.Alignment;
import ir.ipaam.pdflayout.domain.model.element.Break;
import ir.ipaam.pdflayout.domain.model.element.Element;
import ir.ipaam.pdflayout.domain.model.element.FrameCellDecorator;
import ir.ipaam.pdflayout.domain.model.element.LinearLayout;
import ir.ipaam.pdflayout.domain.model.element.PageBreak;
import ir.ipaam.pdflayout.domain.model.element.Paragraph;
import ir.ipaam.pdflayout.domain.model.element.StyledString;
import ir.ipaam.pdflayout.domain.model.element.TableLayout;
import ir.ipaam.pdflayout.domain.model.geometry.Margins;
import ir.ipaam.pdflayout.domain.model.style.Color;
import ir.ipaam.pdflayout.domain.model.style.Style;

import java.util.ArrayList;
import java.util.List;

/** Turns request blocks into layout elements. */
public final class DocumentRequestMapper {

    static final int HEADER_FONT_SIZE = 10;

    private DocumentRequestMapper() {}

    public static List<Element> toElements(List<BlockRequest> blocks) throws LayoutException {
        List<Element> elements = new ArrayList<>(blocks.size());
        for (BlockRequest block : blocks) {
            elements.add(toElement(block));
        }
        return elements;
    }

    public static Element toElement(BlockRequest block) throws LayoutException {
        return switch (block.getType()) {
            case PARAGRAPH -> toParagraph(block);
            case BREAK -> new Break(block.getLines() == null ? 1 : block.getLines());
            case PAGE_BREAK -> new PageBreak();
            case TABLE -> toTable(block);
        };
    }

    /**
     * Header printing {@code text} and the page number on every page but the first,
     * followed by an empty line. Returns {@code null} for a blank text.
     */
    public static PageHeader toHeader(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return pageNumber -> {
            if (pageNumber <= 1) {
                return null;
            }
            Paragraph title = new Paragraph(text + " " + pageNumber).aligned(Alignment.CENTER);
            return LinearLayout.vertical()
                    .element(title)
                    .element(new Break(1))
                    .styled(Style.empty().withFontSize(HEADER_FONT_SIZE));
        };
    }

    public static Style toStyle(RunRequest run) {
        Style style = Style.empty();
        if (run.getBold() != null) {
            style = style.withBold(run.getBold());
        }
        if (run.getItalic() != null) {
            style = style.withItalic(run.getItalic());
        }
        if (run.getFontSize() != null) {
            style = style.withFontSize(run.getFontSize());
        }
        if (run.getColor() != null) {
            style = style.withColor(toColor(run.getColor()));
        }
        return style;
    }

    private static Element toParagraph(BlockRequest block) {
        Paragraph paragraph = new Paragraph();
        for (RunRequest run : block.getRuns()) {
            paragraph.push(new StyledString(run.getText(), toStyle(run)));
        }
        if (block.getAlignment() != null) {
            paragraph.setAlignment(block.getAlignment());
        }
        Element element = paragraph;
        if (block.getPadding() != null) {
            element = element.padded(Margins.all(block.getPadding()));
        }
        if (block.isFramed()) {
            element = element.framed();
        }
        return element;
    }

    private static TableLayout toTable(BlockRequest block) throws LayoutException {
        TableLayout table = new TableLayout(block.getWeights());
        if (block.isGrid()) {
            table.setCellDecorator(new FrameCellDecorator(true, true, true));
        }
        for (RowRequest row : block.getRows()) {
            TableLayout.RowBuilder builder = table.row();
            for (String cell : row.getCells()) {
                builder.element(new Paragraph(cell == null ? "" : cell));
            }
            if (row.getBackground() != null) {
                builder.setBackgroundColor(toColor(row.getBackground()));
            }
            builder.push();
        }
        return table;
    }

    private static Color toColor(ColorRequest color) {
        return Color.rgb(color.getRed(), color.getGreen(), color.getBlue());
    }
}
