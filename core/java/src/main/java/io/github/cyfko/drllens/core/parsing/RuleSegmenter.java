package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.BracketKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a line of a rule into {@link Segment}s so that clause keywords sharing a line with
 * other text are seen on their own.
 * <p>
 * A standalone {@code when} or {@code then} word at bracket depth 0 (outside literals and
 * comments) splits the line. A trailing {@code end} is split off when the line was already
 * split or when the code before it ends with {@code ;}, {@code )} or {@code }}. Thus
 * {@code rule "A" when Person() then end} reads like the multi-line form while
 * {@code return end} inside an action stays untouched.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RuleSegmenter {

    private static final String[] SPLIT_WORDS = {"when", "then"};
    private static final String END = "end";

    private RuleSegmenter() {
    }

    /**
     * @param line       raw line text
     * @param lineNumber line index
     * @param from       first column to consider
     * @return segments in column order, possibly empty
     */
    public static List<Segment> split(String line, int lineNumber, int from) {
        int end = CodeScanner.codeEnd(line);
        List<Segment> segments = new ArrayList<>();
        if (from >= end) {
            return segments;
        }
        boolean[] code = new boolean[end];
        int[] depth = new int[end];
        int[] current = {0};
        new CodeScanner().scan(line, from, end, (c, column) -> {
            code[column] = true;
            if (BracketKind.isOpening(c)) {
                depth[column] = current[0]++;
            } else if (BracketKind.of(c) != null) {
                depth[column] = --current[0];
            } else {
                depth[column] = current[0];
            }
        });

        int pieceStart = from;
        boolean split = false;
        for (int i = from; i < end; i++) {
            String word = splitWordAt(line, i, from, end, code, depth);
            if (word != null) {
                addTrimmed(segments, line, lineNumber, pieceStart, i);
                segments.add(new Segment(lineNumber, i, word));
                i += word.length() - 1;
                pieceStart = i + 1;
                split = true;
            }
        }
        addTrailingPiece(segments, line, lineNumber, pieceStart, end, split, code, depth);
        return segments;
    }

    private static String splitWordAt(String line, int i, int from, int end, boolean[] code, int[] depth) {
        if (!code[i] || depth[i] > 0) {
            return null;
        }
        for (String word : SPLIT_WORDS) {
            if (isStandalone(line, i, word, from, end, code)) {
                return word;
            }
        }
        return null;
    }

    private static boolean isStandalone(String line, int i, String word, int from, int end, boolean[] code) {
        int after = i + word.length();
        if (after > end || !line.startsWith(word, i) || !code[after - 1]) {
            return false;
        }
        boolean startOk = i == from || Character.isWhitespace(line.charAt(i - 1));
        boolean endOk = after == end || Character.isWhitespace(line.charAt(after));
        return startOk && endOk;
    }

    private static void addTrailingPiece(List<Segment> segments, String line, int lineNumber, int start, int end,
                                         boolean split, boolean[] code, int[] depth) {
        int last = end - 1;
        while (last >= start && Character.isWhitespace(line.charAt(last))) {
            last--;
        }
        int endWord = last - END.length() + 1;
        boolean trailingEnd = endWord > start
                && line.startsWith(END, endWord)
                && Character.isWhitespace(line.charAt(endWord - 1))
                && code[endWord] && depth[endWord] <= 0;
        if (trailingEnd) {
            int before = endWord - 1;
            while (before >= start && Character.isWhitespace(line.charAt(before))) {
                before--;
            }
            char previous = before >= start ? line.charAt(before) : ' ';
            if (split || previous == ';' || previous == ')' || previous == '}') {
                addTrimmed(segments, line, lineNumber, start, endWord);
                segments.add(new Segment(lineNumber, endWord, END));
                return;
            }
        }
        addTrimmed(segments, line, lineNumber, start, end);
    }

    private static void addTrimmed(List<Segment> segments, String line, int lineNumber, int start, int end) {
        int s = start;
        int e = end;
        while (s < e && Character.isWhitespace(line.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(line.charAt(e - 1))) {
            e--;
        }
        if (s < e) {
            segments.add(new Segment(lineNumber, s, line.substring(s, e)));
        }
    }
}
