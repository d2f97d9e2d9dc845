package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.model.element.Paragraph;
import ir.ipaam.pdflayout.domain.model.element.StyledString;
import ir.ipaam.pdflayout.domain.model.geometry.Position;
import ir.ipaam.pdflayout.domain.model.geometry.Size;
import ir.ipaam.pdflayout.domain.model.style.Style;
import ir.ipaam.pdflayout.domain.render.TextRun;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy line wrapping of paragraphs.
 * <p>
 * The runs of a paragraph are split into words, each keeping its trailing
 * whitespace. Words are added to a line as long as the line, without the trailing
 * whitespace of its last word, fits the area width. Words may span several runs;
 * the kerning between runs is measured like any other glyph pair.
 * <p>
 * All lines share one baseline policy: the line height is the largest line height
 * of the styles on the line and the baseline sits at the largest ascent.
 */
class ParagraphRenderer {

    private final TextMeasurer measurer;

    ParagraphRenderer(TextMeasurer measurer) {
        this.measurer = measurer;
    }

    RenderOutcome render(Paragraph paragraph, Area area, Style style) throws LayoutException {
        List<Word> words = split(paragraph, style);
        Size size = Size.ZERO;
        int index = 0;

        while (index < words.size()) {
            List<Word> line = new ArrayList<>();
            int next = index;
            double lineWidth = 0;
            while (next < words.size()) {
                Word word = words.get(next);
                line.add(word);
                double width = visibleWidth(line);
                if (!area.fitsWidth(width)) {
                    line.remove(line.size() - 1);
                    if (line.isEmpty()) {
                        throw new LayoutException("Word '" + word.text().strip() + "' is wider than the available "
                                + String.format("%.2f", area.width()) + " mm and cannot be wrapped");
                    }
                    break;
                }
                lineWidth = width;
                next++;
                if (word.lineBreak()) {
                    break;
                }
            }

            double lineHeight = 0;
            double ascent = 0;
            for (Word word : line) {
                for (Fragment fragment : word.fragments()) {
                    lineHeight = Math.max(lineHeight, measurer.lineHeight(fragment.resolved()));
                    ascent = Math.max(ascent, measurer.ascent(fragment.resolved()));
                }
            }
            if (!area.fitsHeight(lineHeight)) {
                break;
            }

            printLine(line, area, paragraph.alignment().offset(lineWidth, area.width()), ascent);
            area.addOffset(lineHeight);
            size = size.stackVertical(new Size(lineWidth, lineHeight));
            index = next;
        }

        if (index == words.size()) {
            return RenderOutcome.complete(size);
        }
        if (index == 0) {
            return RenderOutcome.stalled(paragraph);
        }
        return RenderOutcome.continued(size, Paragraph.of(remainingRuns(words, index), paragraph.alignment()));
    }

    private void printLine(List<Word> line, Area area, double x, double ascent) {
        List<Fragment> runs = coalesce(trimmed(line));
        for (int i = 0; i < runs.size(); i++) {
            Fragment run = runs.get(i);
            Style style = run.resolved();
            area.printText(new TextRun(new Position(x, ascent), run.text(), style.font(), style.fontSize(),
                    style.color(), measurer.kerning(style, run.text())));
            x += measurer.width(style, run.text());
            if (i + 1 < runs.size()) {
                x += kerningBetween(run, runs.get(i + 1));
            }
        }
    }

    /** Width of the line without the trailing whitespace of its last word. */
    private double visibleWidth(List<Word> line) {
        List<Fragment> fragments = trimmed(line);
        double width = 0;
        for (int i = 0; i < fragments.size(); i++) {
            Fragment fragment = fragments.get(i);
            width += measurer.width(fragment.resolved(), fragment.text());
            if (i + 1 < fragments.size()) {
                width += kerningBetween(fragment, fragments.get(i + 1));
            }
        }
        return width;
    }

    private double kerningBetween(Fragment left, Fragment right) {
        String l = left.text();
        return measurer.kerningBetween(left.resolved(), l.codePointBefore(l.length()),
                right.resolved(), right.text().codePointAt(0));
    }

    /** Non-empty fragments of the line with the trailing whitespace removed. */
    private static List<Fragment> trimmed(List<Word> line) {
        List<Fragment> fragments = new ArrayList<>();
        for (Word word : line) {
            fragments.addAll(word.fragments());
        }
        for (int i = fragments.size() - 1; i >= 0; i--) {
            Fragment last = fragments.get(i);
            String text = last.text().stripTrailing();
            if (!text.isEmpty()) {
                fragments.set(i, last.withText(text));
                break;
            }
            fragments.remove(i);
        }
        fragments.removeIf(fragment -> fragment.text().isEmpty());
        return fragments;
    }

    /** Merges neighbouring fragments drawn in the same style into one run. */
    private static List<Fragment> coalesce(List<Fragment> fragments) {
        List<Fragment> runs = new ArrayList<>();
        for (Fragment fragment : fragments) {
            int last = runs.size() - 1;
            if (last >= 0 && runs.get(last).resolved().equals(fragment.resolved())) {
                Fragment previous = runs.get(last);
                runs.set(last, previous.withText(previous.text() + fragment.text()));
            } else {
                runs.add(fragment);
            }
        }
        return runs;
    }

    private static List<StyledString> remainingRuns(List<Word> words, int from) {
        List<StyledString> runs = new ArrayList<>();
        for (Word word : words.subList(from, words.size())) {
            List<Fragment> fragments = word.fragments();
            for (int i = 0; i < fragments.size(); i++) {
                Fragment fragment = fragments.get(i);
                String text = fragment.text();
                if (word.lineBreak() && i == fragments.size() - 1) {
                    text += "\n";
                }
                int last = runs.size() - 1;
                if (last >= 0 && runs.get(last).style().equals(fragment.local())) {
                    runs.set(last, new StyledString(runs.get(last).text() + text, fragment.local()));
                } else if (!text.isEmpty()) {
                    runs.add(new StyledString(text, fragment.local()));
                }
            }
        }
        return runs;
    }

    private static List<Word> split(Paragraph paragraph, Style style) {
        List<Word> words = new ArrayList<>();
        List<Fragment> current = new ArrayList<>();
        boolean inWhitespace = false;

        for (StyledString run : paragraph.runs()) {
            Style resolved = style.merge(run.style());
            StringBuilder piece = new StringBuilder();
            int[] codePoints = run.text().codePoints().toArray();
            for (int codePoint : codePoints) {
                if (codePoint == '\n') {
                    current.add(new Fragment(piece.toString(), run.style(), resolved));
                    piece.setLength(0);
                    words.add(new Word(current, true));
                    current = new ArrayList<>();
                    inWhitespace = false;
                    continue;
                }
                boolean whitespace = Character.isWhitespace(codePoint);
                if (!whitespace && inWhitespace) {
                    if (piece.length() > 0) {
                        current.add(new Fragment(piece.toString(), run.style(), resolved));
                        piece.setLength(0);
                    }
                    words.add(new Word(current, false));
                    current = new ArrayList<>();
                }
                inWhitespace = whitespace;
                piece.appendCodePoint(whitespace ? ' ' : codePoint);
            }
            if (piece.length() > 0) {
                current.add(new Fragment(piece.toString(), run.style(), resolved));
            }
        }
        if (!current.isEmpty()) {
            words.add(new Word(current, false));
        }
        return words;
    }

    /**
     * Part of a word drawn in one style.
     *
     * @param local    the style as given on the paragraph run
     * @param resolved the local style resolved against the surrounding style
     */
    private record Fragment(String text, Style local, Style resolved) {

        Fragment withText(String text) {
            return new Fragment(text, local, resolved);
        }
    }

    /** A word with its trailing whitespace, possibly ending in a forced line break. */
    private record Word(List<Fragment> fragments, boolean lineBreak) {

        String text() {
            StringBuilder text = new StringBuilder();
            for (Fragment fragment : fragments) {
                text.append(fragment.text());
            }
            return text.toString();
        }
    }
}
