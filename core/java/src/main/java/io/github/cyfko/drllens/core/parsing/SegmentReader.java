package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.Position;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Segment-by-segment reader over the body of a rule or query.
 * <p>
 * Lines are segmented lazily with {@link RuleSegmenter}; blank and comment lines are
 * skipped. The reader remembers whether the next segment is the first one of its line, which
 * is where a missing {@code end} is detected (a header of the next construct).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SegmentReader {

    private final SourceLines source;
    private final Deque<Segment> queue = new ArrayDeque<>();
    private int line;
    private boolean freshLine;
    private Position lastEnd;

    /**
     * @param source     the document
     * @param line       line holding the construct header
     * @param fromColumn first column after the header on that line
     * @param headerEnd  end of the header, the initial {@link #lastEnd()}
     */
    public SegmentReader(SourceLines source, int line, int fromColumn, Position headerEnd) {
        this.source = source;
        this.line = line;
        this.lastEnd = headerEnd;
        queue.addAll(RuleSegmenter.split(source.line(line), line, fromColumn));
    }

    public SourceLines source() {
        return source;
    }

    /**
     * @return the next segment, or {@code null} at the end of the document
     */
    public Segment peek() {
        fill();
        return queue.peekFirst();
    }

    public Segment advance() {
        fill();
        Segment segment = queue.pollFirst();
        if (segment != null) {
            lastEnd = segment.end();
            freshLine = false;
        }
        return segment;
    }

    /**
     * Tells whether {@link #peek()} is the first segment of its line.
     */
    public boolean atLineStart() {
        fill();
        return freshLine && !queue.isEmpty();
    }

    /**
     * Segments still queued on the current line, without reading further lines.
     */
    public List<Segment> remainingOnLine() {
        return List.copyOf(queue);
    }

    /**
     * Replaces the queue, used after raw line reading (action text).
     */
    public void reposition(int newLine, List<Segment> segments, boolean lineStart) {
        line = newLine;
        queue.clear();
        queue.addAll(segments);
        freshLine = lineStart;
    }

    public Position lastEnd() {
        return lastEnd;
    }

    public void lastEnd(Position position) {
        this.lastEnd = position;
    }

    /**
     * Cursor where top-level dispatch resumes: the current line when nothing of it was
     * consumed, the following line otherwise.
     */
    public ParseCursor resumeCursor() {
        boolean untouched = freshLine && !queue.isEmpty();
        return new ParseCursor(source, untouched ? line : line + 1);
    }

    private void fill() {
        while (queue.isEmpty()) {
            ParseCursor next = new ParseCursor(source, line + 1).skipTrivia();
            if (next.atEnd()) {
                return;
            }
            line = next.line();
            queue.addAll(RuleSegmenter.split(source.line(line), line, 0));
            freshLine = true;
        }
    }
}
