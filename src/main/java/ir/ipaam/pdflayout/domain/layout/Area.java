package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.model.geometry.Margins;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.Color;
import ir.ipaam.pdflayout.domain.model.style.LineStyle;
import ir.ipaam.pdflayout.domain.render.LineSegment;
import ir.ipaam.pdflayout.domain.render.Rectangle;
import ir.ipaam.pdflayout.domain.render.TextRun;

import java.util.ArrayList;
import java.util.List;

/**
 * A rectangular region of a page with a cursor tracking how much of its height
 * has been used.
 * <p>
 * Positions passed to the drawing methods are relative to the cursor, i.e. to
 * the top left corner of the unused part of the area. The cursor never moves
 * past the bottom of the area; an area with no height left accepts no content.
 */
public final class Area {

    /** Slack allowed when comparing measured sizes against the available space. */
    public static final double TOLERANCE = 1e-6;

    private final Canvas canvas;
    private final Position origin;
    private final double width;
    private final double height;
    private double offset;

    public Area(Canvas canvas, Position origin, Size size) {
        this.canvas = canvas;
        this.origin = origin;
        this.width = size.width();
        this.height = size.height();
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public double offset() {
        return offset;
    }

    public double remainingHeight() {
        return height - offset;
    }

    public boolean fitsHeight(double h) {
        return h <= remainingHeight() + TOLERANCE;
    }

    public boolean fitsWidth(double w) {
        return w <= width + TOLERANCE;
    }

    /** Absolute page position of the cursor. */
    public Position cursor() {
        return origin.translate(0, offset);
    }

    public Canvas canvas() {
        return canvas;
    }

    /** Moves the cursor down, at most to the bottom of the area. */
    public void addOffset(double dy) {
        if (dy < 0) {
            throw new IllegalArgumentException("Cursor cannot move up: " + dy);
        }
        offset = Math.min(height, offset + dy);
    }

    /** A fresh area covering the unused part of this one. */
    public Area remainder() {
        return new Area(canvas, cursor(), new Size(width, remainingHeight()));
    }

    /** The unused part of this area shrunk by {@code margins}, clamped at zero size. */
    public Area inset(Margins margins) {
        Size size = new Size(
                Math.max(0, width - margins.horizontal()),
                Math.max(0, remainingHeight() - margins.vertical()));
        return new Area(canvas, cursor().translate(margins.left(), margins.top()), size);
    }

    /** The unused part of this area drawing onto another canvas. */
    public Area onCanvas(Canvas other) {
        return new Area(other, cursor(), new Size(width, remainingHeight()));
    }

    /**
     * Splits the unused part of this area into columns proportional to {@code weights}.
     * The last column takes the rounding residual so the widths add up to exactly
     * {@link #width()}.
     */
    public List<Area> splitHorizontally(List<Integer> weights) {
        double[] widths = columnWidths(width, weights);
        List<Area> columns = new ArrayList<>(widths.length);
        double x = 0;
        for (double columnWidth : widths) {
            columns.add(new Area(canvas, cursor().translate(x, 0), new Size(columnWidth, remainingHeight())));
            x += columnWidth;
        }
        return columns;
    }

    public static double[] columnWidths(double available, List<Integer> weights) {
        double total = 0;
        for (int weight : weights) {
            total += weight;
        }
        double[] widths = new double[weights.size()];
        double used = 0;
        for (int i = 0; i < widths.length - 1; i++) {
            widths[i] = available * weights.get(i) / total;
            used += widths[i];
        }
        double last = Math.max(0, available - used);
        // the subtraction can round; step the last width until the sum is exact
        while (used + last < available) {
            last = Math.nextUp(last);
        }
        while (used + last > available && last > 0) {
            last = Math.nextDown(last);
        }
        widths[widths.length - 1] = last;
        return widths;
    }

    public void drawLine(Position from, Position to, LineStyle style) {
        Position base = cursor();
        canvas.add(new LineSegment(
                base.translate(from.x(), from.y()),
                base.translate(to.x(), to.y()),
                style));
    }

    public void fillRect(Position topLeft, Size size, Color color) {
        canvas.add(Rectangle.filled(cursor().translate(topLeft.x(), topLeft.y()), size, color));
    }

    /** Adds a text run whose baseline is given relative to the cursor. */
    public void printText(TextRun run) {
        Position base = cursor();
        canvas.add(new TextRun(base.translate(run.baseline().x(), run.baseline().y()),
                run.text(), run.font(), run.fontSize(), run.color(), run.kerning()));
    }
}
