package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable line view of a document.
 * <p>
 * Lines are split on {@code '\n'}; a trailing {@code '\r'} is removed from each line so that
 * columns are identical for LF and CRLF files. Line start offsets are kept to translate
 * character offsets of the original text into line numbers.
 * </p>
 * <p>
 * The parser reads the {@linkplain #withoutBlockComments() comment-free view}, where block
 * comments are blanked out column for column; {@link #raw(int)} still returns the text as
 * written, for the parts of a construct that are kept verbatim.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SourceLines {

    private final List<String> lines;
    private final List<String> rawLines;
    private final int[] lineStarts;
    private final int textLength;

    private SourceLines(List<String> lines, List<String> rawLines, int[] lineStarts, int textLength) {
        this.lines = lines;
        this.rawLines = rawLines;
        this.lineStarts = lineStarts;
        this.textLength = textLength;
    }

    /**
     * Splits {@code text} into lines. A {@code null} text is treated as empty.
     */
    public static SourceLines of(String text) {
        String source = text == null ? "" : text;
        List<String> lines = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        int start = 0;
        while (true) {
            int newline = source.indexOf('\n', start);
            int end = newline < 0 ? source.length() : newline;
            String line = source.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
            starts.add(start);
            if (newline < 0) {
                break;
            }
            start = newline + 1;
        }
        List<String> copy = List.copyOf(lines);
        return new SourceLines(copy, copy, starts.stream().mapToInt(Integer::intValue).toArray(), source.length());
    }

    public int size() {
        return lines.size();
    }

    /**
     * @return the line at {@code index}, or an empty string outside the document
     */
    public String line(int index) {
        return index >= 0 && index < lines.size() ? lines.get(index) : "";
    }

    /**
     * @return the line at {@code index} as written, comments included
     */
    public String raw(int index) {
        return index >= 0 && index < rawLines.size() ? rawLines.get(index) : "";
    }

    public List<String> asList() {
        return lines;
    }

    /**
     * Same document with block comments replaced by spaces; a line holding nothing but comment
     * text becomes blank. Comments do not nest and an unclosed one runs to the end.
     */
    public SourceLines withoutBlockComments() {
        CodeScanner scanner = new CodeScanner();
        List<String> masked = new ArrayList<>(lines.size());
        for (String line : lines) {
            masked.add(scanner.maskBlockComments(line));
        }
        return new SourceLines(List.copyOf(masked), rawLines, lineStarts, textLength);
    }

    /**
     * Copies lines {@code [fromLine, toLine]}, as written, into a standalone document.
     */
    public SourceLines slice(int fromLine, int toLine) {
        if (fromLine > toLine) {
            return of("");
        }
        List<String> part = rawLines.subList(Math.max(0, fromLine), Math.min(lines.size(), toLine + 1));
        return of(String.join("\n", part));
    }

    /**
     * Line holding the character at {@code offset}, clamped to the document.
     */
    public int lineOfOffset(int offset) {
        int clamped = Math.max(0, Math.min(offset, textLength));
        int index = Arrays.binarySearch(lineStarts, clamped);
        return index >= 0 ? index : -index - 2;
    }

    /**
     * Position just after the last character of the document.
     */
    public Position endPosition() {
        int last = lines.size() - 1;
        return new Position(last, rawLines.get(last).length());
    }

    public Range fullRange() {
        return new Range(new Position(0, 0), endPosition());
    }
}
