package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.config.DrlKeywords;
import io.github.cyfko.drllens.core.model.BracketKind;
import io.github.cyfko.drllens.core.model.BracketPair;
import io.github.cyfko.drllens.core.model.PatternRegion;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Follows the brackets of one condition across segments and records construct regions.
 * <p>
 * Bracket matching is delegated to a {@link BracketTracker}, the same matcher the bracket
 * balance pass runs over the whole document. A construct keyword ({@code exists}, {@code not},
 * {@code eval}, {@code forall}, {@code collect}, {@code accumulate}) directly before a
 * {@code (} opens a region that its matching {@code )} closes. Regions are appended to a flat
 * list and point at their parent by index. Nesting is counted, never recursed into; past
 * {@code maxDepth} no further region is opened and {@link #depthExceeded()} turns true, while
 * bracket balance keeps being tracked.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class PatternRegionTracker {

    private final int maxDepth;
    private final BracketTracker brackets = new BracketTracker();
    private final List<OpenRegion> regions = new ArrayList<>();
    private final Map<Position, Integer> regionByOpening = new HashMap<>();
    private final Deque<Integer> openRegions = new ArrayDeque<>();
    private int deepest;
    private boolean depthExceeded;
    private Position lastPosition = new Position(0, 0);

    PatternRegionTracker(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    void feed(Segment segment) {
        String text = segment.text();
        brackets.feed(text, segment.line(), segment.column(), (c, column, position, partner) -> {
            if (c == '(') {
                open(text, column, position);
            } else if (c == ')' && partner != null) {
                close(partner, position);
            }
        });
        lastPosition = segment.end();
    }

    private void open(String text, int column, Position position) {
        int keywordStart = keywordStart(text, column);
        if (keywordStart < 0) {
            return;
        }
        if (openRegions.size() >= maxDepth) {
            depthExceeded = true;
            return;
        }
        int regionIndex = regions.size();
        String keyword = text.substring(keywordStart, wordEnd(text, keywordStart));
        Position start = new Position(position.line(), position.character() - (column - keywordStart));
        regions.add(new OpenRegion(keyword, openRegions.isEmpty() ? -1 : openRegions.peek(), openRegions.size(), start));
        regionByOpening.put(position, regionIndex);
        openRegions.push(regionIndex);
        deepest = Math.max(deepest, openRegions.size());
    }

    private void close(Position opening, Position position) {
        Integer regionIndex = regionByOpening.remove(opening);
        if (regionIndex != null) {
            regions.get(regionIndex).end = new Position(position.line(), position.character() + 1);
            openRegions.remove(regionIndex);
        }
    }
    /**
     * Start column of a construct keyword ending right before {@code column} (spaces allowed),
     * or {@code -1}.
     */
    private static int keywordStart(String text, int column) {
        int end = column;
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && Character.isJavaIdentifierPart(text.charAt(start - 1))) {
            start--;
        }
        if (start == end || (start > 0 && text.charAt(start - 1) == '.')) {
            return -1;
        }
        return DrlKeywords.CONSTRUCT_KEYWORDS.contains(text.substring(start, end)) ? start : -1;
    }

    private static int wordEnd(String text, int start) {
        int end = start;
        while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
            end++;
        }
        return end;
    }

    boolean isOpen() {
        return brackets.depth(BracketKind.PARENTHESIS) > 0 || brackets.depth(BracketKind.BRACE) > 0;
    }

    int openParentheses() {
        return brackets.depth(BracketKind.PARENTHESIS);
    }

    /**
     * Outermost bracket still open, parentheses first, or {@code null} when all are closed.
     */
    Position firstUnclosed() {
        List<UnmatchedBracket> unclosed = brackets.finish().unmatched().stream()
                .filter(UnmatchedBracket::opening)
                .filter(b -> b.kind() == BracketKind.PARENTHESIS || b.kind() == BracketKind.BRACE)
                .toList();
        return unclosed.stream()
                .filter(b -> b.kind() == BracketKind.PARENTHESIS)
                .findFirst()
                .or(() -> unclosed.stream().findFirst())
                .map(UnmatchedBracket::position)
                .orElse(null);
    }

    boolean depthExceeded() {
        return depthExceeded;
    }

    int nestingDepth() {
        return deepest;
    }

    List<BracketPair> pairs() {
        return brackets.finish().pairs().stream()
                .filter(pair -> pair.kind() == BracketKind.PARENTHESIS)
                .toList();
    }

    List<PatternRegion> regions() {
        List<PatternRegion> result = new ArrayList<>(regions.size());
        for (OpenRegion region : regions) {
            boolean complete = region.end != null;
            Position end = complete ? region.end : lastPosition;
            if (end.isBefore(region.start)) {
                end = region.start;
            }
            result.add(new PatternRegion(region.keyword, region.parent, region.depth, new Range(region.start, end), complete));
        }
        return result;
    }

    private static final class OpenRegion {
        private final String keyword;
        private final int parent;
        private final int depth;
        private final Position start;
        private Position end;

        private OpenRegion(String keyword, int parent, int depth, Position start) {
            this.keyword = keyword;
            this.parent = parent;
            this.depth = depth;
            this.start = start;
        }
    }
}
