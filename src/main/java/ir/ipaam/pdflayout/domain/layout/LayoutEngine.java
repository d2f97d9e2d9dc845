package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.font.FontBackend;
import ir.ipaam.pdflayout.domain.model.element.Break;
import ir.ipaam.pdflayout.domain.model.element.Element;
import ir.ipaam.pdflayout.domain.model.element.FramedElement;
import ir.ipaam.pdflayout.domain.model.element.LinearLayout;
import ir.ipaam.pdflayout.domain.model.element.PaddedElement;
import ir.ipaam.pdflayout.domain.model.element.PageBreak;
import ir.ipaam.pdflayout.domain.model.element.Paragraph;
import ir.ipaam.pdflayout.domain.model.element.StyledElement;
import ir.ipaam.pdflayout.domain.model.element.TableLayout;
import ir.ipaam.pdflayout.domain.model.element.Text;
import ir.ipaam.pdflayout.domain.model.geometry.Margins;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.LineStyle;
import ir.ipaam.pdflayout.domain.model.style.Style;
import ir.ipaam.pdflayout.domain.render.TextRun;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders element trees into areas.
 * <p>
 * Every element either fits completely or reports the remainder that did not
 * fit. An element that could not place anything returns itself as the
 * remainder (see {@link RenderOutcome#isStalled(Element)}), which lets the
 * caller tell a full page from content that can never fit.
 */
public class LayoutEngine {

    private final TextMeasurer measurer;
    private final ParagraphRenderer paragraphs;
    private final TableRenderer tables;

    public LayoutEngine(FontBackend fonts) {
        this.measurer = new TextMeasurer(fonts);
        this.paragraphs = new ParagraphRenderer(measurer);
        this.tables = new TableRenderer(this);
    }

    /**
     * Renders {@code element} into the unused part of {@code area}. The area's
     * cursor is not moved; callers advance it by the reported size.
     *
     * @param style the fully resolved style inherited from the ancestors
     */
    public RenderOutcome render(Element element, Area area, Style style) throws LayoutException {
        Area target = area.remainder();
        if (element instanceof Text text) {
            return renderText(text, target, style);
        } else if (element instanceof Paragraph paragraph) {
            return paragraphs.render(paragraph, target, style);
        } else if (element instanceof LinearLayout layout) {
            return renderLinear(layout, target, style);
        } else if (element instanceof TableLayout table) {
            return tables.render(table, target, style);
        } else if (element instanceof Break lineBreak) {
            return renderBreak(lineBreak, target, style);
        } else if (element instanceof PageBreak pageBreak) {
            return pageBreak.isTaken()
                    ? RenderOutcome.complete(Size.ZERO)
                    : RenderOutcome.continued(Size.ZERO, pageBreak.taken());
        } else if (element instanceof StyledElement styled) {
            return renderStyled(styled, target, style);
        } else if (element instanceof FramedElement framed) {
            return renderFramed(framed, target, style);
        } else if (element instanceof PaddedElement padded) {
            return renderPadded(padded, target, style);
        }
        throw new IllegalArgumentException("Unsupported element type " + element.getClass().getName());
    }

    private RenderOutcome renderText(Text text, Area area, Style style) throws LayoutException {
        Style resolved = style.merge(text.content().style());
        String content = text.content().text();
        double width = measurer.width(resolved, content);
        double height = measurer.lineHeight(resolved);
        if (!area.fitsWidth(width)) {
            throw new LayoutException("Text '" + content + "' is wider than the available "
                    + String.format("%.2f", area.width()) + " mm");
        }
        if (!area.fitsHeight(height)) {
            return RenderOutcome.stalled(text);
        }
        if (!content.isEmpty()) {
            area.printText(new TextRun(new Position(0, measurer.ascent(resolved)), content, resolved.font(),
                    resolved.fontSize(), resolved.color(), measurer.kerning(resolved, content)));
        }
        return RenderOutcome.complete(new Size(width, height));
    }

    private RenderOutcome renderLinear(LinearLayout layout, Area area, Style style) throws LayoutException {
        List<Element> children = layout.children();
        Size size = Size.ZERO;
        for (int i = 0; i < children.size(); i++) {
            Element child = children.get(i);
            RenderOutcome outcome = render(child, area, style);
            size = size.stackVertical(outcome.size());
            area.addOffset(outcome.size().height());

            if (outcome instanceof RenderOutcome.Continued continued) {
                if (i == 0 && outcome.isStalled(child)) {
                    return RenderOutcome.stalled(layout);
                }
                List<Element> rest = new ArrayList<>(children.size() - i);
                rest.add(continued.continuation());
                rest.addAll(children.subList(i + 1, children.size()));
                return RenderOutcome.continued(size, LinearLayout.of(rest));
            }
        }
        return RenderOutcome.complete(size);
    }

    private RenderOutcome renderBreak(Break lineBreak, Area area, Style style) {
        double height = lineBreak.lines() * measurer.lineHeight(style);
        return RenderOutcome.complete(new Size(0, Math.min(height, area.remainingHeight())));
    }

    private RenderOutcome renderStyled(StyledElement styled, Area area, Style style) throws LayoutException {
        RenderOutcome outcome = render(styled.element(), area, style.merge(styled.style()));
        if (outcome instanceof RenderOutcome.Continued continued) {
            if (outcome.isStalled(styled.element())) {
                return RenderOutcome.stalled(styled);
            }
            return RenderOutcome.continued(outcome.size(), new StyledElement(continued.continuation(), styled.style()));
        }
        return outcome;
    }

    private RenderOutcome renderPadded(PaddedElement padded, Area area, Style style) throws LayoutException {
        Margins padding = padded.padding();
        RenderOutcome outcome = render(padded.element(), area.inset(padding), style);
        Size size = outcome.size().grow(padding.horizontal(), padding.vertical());
        if (outcome instanceof RenderOutcome.Continued continued) {
            if (outcome.isStalled(padded.element())) {
                return RenderOutcome.stalled(padded);
            }
            return RenderOutcome.continued(size, new PaddedElement(continued.continuation(), padding));
        }
        return RenderOutcome.complete(size);
    }

    /**
     * The first segment of a frame is closed at the top, the last one at the
     * bottom; the sides are drawn on every page.
     */
    private RenderOutcome renderFramed(FramedElement framed, Area area, Style style) throws LayoutException {
        LineStyle line = framed.lineStyle();
        double t = line.thickness();
        boolean top = !framed.isContinuation();
        Margins insets = new Margins(top ? t : 0, t, t, t);

        RenderOutcome outcome = render(framed.element(), area.inset(insets), style);
        if (outcome.isStalled(framed.element())) {
            return RenderOutcome.stalled(framed);
        }
        boolean bottom = outcome.isComplete();
        double height = insets.top() + outcome.size().height() + (bottom ? t : 0);
        double width = area.width();
        double half = t / 2;

        if (top) {
            area.drawLine(new Position(0, half), new Position(width, half), line);
        }
        area.drawLine(new Position(half, 0), new Position(half, height), line);
        area.drawLine(new Position(width - half, 0), new Position(width - half, height), line);
        if (bottom) {
            area.drawLine(new Position(0, height - half), new Position(width, height - half), line);
        }

        Size size = new Size(width, height);
        if (outcome instanceof RenderOutcome.Continued continued) {
            return RenderOutcome.continued(size, framed.continueWith(continued.continuation()));
        }
        return RenderOutcome.complete(size);
    }
}
