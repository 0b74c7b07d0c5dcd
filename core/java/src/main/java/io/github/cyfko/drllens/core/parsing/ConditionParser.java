package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.BracketPair;
import io.github.cyfko.drllens.core.model.ConditionKind;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.ConstraintNode;
import io.github.cyfko.drllens.core.model.PatternRegion;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses one condition of a {@code when} clause or query body.
 * <p>
 * A condition starts at the current segment and continues over the following segments while
 * its parentheses or braces are open. The continuation stops at {@code then}, {@code end} or
 * a construct header; the condition is then recorded as incomplete and kept, and the error
 * points at the outermost bracket left open.
 * </p>
 * <p>
 * The fact pattern's {@code field operator value} constraints are split at top-level commas.
 * Operands of {@code and}/{@code or} and of {@code exists}, {@code not} and {@code forall} are
 * parsed again as inner conditions, down to the policy's nesting limit.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class ConditionParser {

    private static final Pattern BOUND_PATTERN = Pattern.compile("^(\\$?[A-Za-z_]\\w*)\\s*:\\s*([A-Za-z_][\\w.]*)\\s*\\(");
    private static final Pattern UNBOUND_PATTERN = Pattern.compile("^([A-Za-z_][\\w.]*)\\s*\\(");
    private static final Pattern LEADING_KEYWORD = Pattern.compile("^(exists|not|eval|forall|collect|accumulate)\\b");
    private static final Pattern CONSTRAINT = Pattern.compile("^(?:\\$[A-Za-z_]\\w*\\s*:\\s*)?([A-Za-z_][\\w.]*)\\s*"
            + "(==|!=|<=|>=|<|>|(?:not\\s+)?(?:matches|contains|memberOf|soundslike|in)\\b)\\s*(.+)$", Pattern.DOTALL);

    private final ParseSession session;

    ConditionParser(ParseSession session) {
        this.session = session;
    }

    /**
     * Consumes one condition from {@code reader}, whose next segment must be its first one.
     */
    ConditionNode parse(SegmentReader reader) {
        Segment first = reader.advance();
        PatternRegionTracker tracker = new PatternRegionTracker(session.policy().maxNestingDepth());
        tracker.feed(first);
        StringBuilder content = new StringBuilder(first.text());
        List<Segment> segments = new ArrayList<>(List.of(first));
        Segment last = first;
        ConditionKind kind = leadingKind(first.text());

        while (tracker.isOpen()) {
            Segment next = reader.peek();
            boolean boundary = next == null || next.isClauseKeyword()
                    || (reader.atLineStart() && TopLevelKeyword.looksLikeHeader(next.text()));
            if (boundary) {
                reportIncomplete(kind, tracker, new Range(first.start(), last.end()));
                if (next == null) {
                    session.markUnterminated();
                }
                break;
            }
            reader.advance();
            tracker.feed(next);
            content.append('\n').append(next.text());
            segments.add(next);
            last = next;
        }

        Range range = new Range(first.start(), last.end());
        if (tracker.depthExceeded()) {
            session.error("Maximum pattern nesting depth of " + session.policy().maxNestingDepth() + " exceeded", range);
        }

        String text = content.toString();
        if (kind == ConditionKind.PATTERN) {
            ConditionKind connective = connective(text);
            if (connective != null) {
                kind = connective;
            }
        }

        return describe(kind, text, 0, range, new ContentMap(segments),
                tracker.pairs(), tracker.regions(), tracker.nestingDepth(), 0);
    }

    /**
     * Builds the node for {@code text}, which starts at {@code offset} in the condition content.
     */
    private ConditionNode describe(ConditionKind kind, String text, int offset, Range range, ContentMap map,
                                   List<BracketPair> pairs, List<PatternRegion> regions, int nestingDepth, int level) {
        String examined = innermostPattern(kind, text);
        int examinedOffset = offset + text.indexOf(examined);
        String variable = null;
        String factType = null;
        int patternOpen = -1;
        Matcher bound = BOUND_PATTERN.matcher(examined);
        if (bound.find()) {
            variable = bound.group(1);
            factType = bound.group(2);
            patternOpen = bound.end() - 1;
        } else {
            Matcher unbound = UNBOUND_PATTERN.matcher(examined);
            if (unbound.find() && ConditionKind.fromKeyword(unbound.group(1)).isEmpty()) {
                factType = unbound.group(1);
                patternOpen = unbound.end() - 1;
            }
        }
        List<ConstraintNode> constraints = patternOpen < 0 ? List.of() : constraints(examined, patternOpen, examinedOffset, map);
        List<ConditionNode> inner = level < session.policy().maxNestingDepth()
                ? innerConditions(kind, text, offset, map, pairs, level)
                : List.of();
        return new ConditionNode(kind, variable, factType, text, range, pairs, regions, nestingDepth, constraints, inner);
    }

    private static List<ConstraintNode> constraints(String pattern, int open, int patternOffset, ContentMap map) {
        int close = TextUtils.findClosingParenthesis(pattern, open);
        String inside = pattern.substring(open + 1, close < 0 ? pattern.length() : close);
        int insideOffset = patternOffset + open + 1;
        List<ConstraintNode> constraints = new ArrayList<>();
        for (int[] part : topLevelParts(inside, false)) {
            Matcher matcher = CONSTRAINT.matcher(inside.substring(part[0], part[1]));
            if (matcher.matches()) {
                constraints.add(new ConstraintNode(matcher.group(1), matcher.group(2).replaceAll("\\s+", " "), matcher.group(3).trim(),
                        map.range(insideOffset + part[0], insideOffset + part[1])));
            }
        }
        return constraints;
    }

    /**
     * Operands of a connective or of an {@code exists}, {@code not} or {@code forall} construct.
     */
    private List<ConditionNode> innerConditions(ConditionKind kind, String text, int offset, ContentMap map,
                                                List<BracketPair> pairs, int level) {
        String operands;
        int operandsOffset;
        switch (kind) {
            case AND, OR -> {
                operands = text;
                operandsOffset = 0;
            }
            case EXISTS, NOT, FORALL -> {
                operands = TextUtils.constructBody(kind.keyword(), text);
                operandsOffset = Math.max(0, text.indexOf(operands, kind.keyword().length()));
            }
            default -> {
                return List.of();
            }
        }
        List<ConditionNode> inner = new ArrayList<>();
        for (int[] part : topLevelParts(operands, true)) {
            String operand = operands.substring(part[0], part[1]);
            int start = offset + operandsOffset + part[0];
            Range range = map.range(start, start + operand.length());
            List<BracketPair> innerPairs = pairs.stream()
                    .filter(pair -> range.contains(pair.open()) && range.contains(pair.close()))
                    .toList();
            inner.add(describe(leadingKind(operand), operand, start, range, map, innerPairs, List.of(), 0, level + 1));
        }
        return inner;
    }

    /**
     * Trimmed parts of {@code text} between top-level separators: commas, or {@code and},
     * {@code or}, {@code &&} and {@code ||} when {@code connectives} is set.
     *
     * @return {@code [start, end)} offsets into {@code text}
     */
    private static List<int[]> topLevelParts(String text, boolean connectives) {
        List<int[]> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        boolean escaped = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            int separator = 0;
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                default -> separator = depth == 0 ? separatorAt(text, i, connectives) : 0;
            }
            if (separator > 0) {
                addPart(parts, text, start, i);
                start = i + separator;
                i += separator - 1;
            }
        }
        addPart(parts, text, start, text.length());
        return parts;
    }

    private static int separatorAt(String text, int i, boolean connectives) {
        if (!connectives) {
            return text.charAt(i) == ',' ? 1 : 0;
        }
        if (text.startsWith("&&", i) || text.startsWith("||", i)) {
            return 2;
        }
        if (isWordAt(text, i, "and")) {
            return 3;
        }
        return isWordAt(text, i, "or") ? 2 : 0;
    }

    private static void addPart(List<int[]> parts, String text, int from, int to) {
        String raw = text.substring(from, to);
        if (!raw.isBlank()) {
            parts.add(new int[]{from + TextUtils.indentOf(raw), from + raw.stripTrailing().length()});
        }
    }

    private void reportIncomplete(ConditionKind kind, PatternRegionTracker tracker, Range condition) {
        int open = tracker.openParentheses();
        String message;
        if (kind.keyword() != null) {
            message = "Incomplete " + kind.keyword() + " pattern: missing closing parenthesis";
        } else if (open > 0) {
            message = "Incomplete condition: " + open + " unclosed parenthes" + (open == 1 ? "is" : "es");
        } else {
            message = "Incomplete condition: missing closing brace";
        }
        Position unclosed = tracker.firstUnclosed();
        session.error(message, unclosed == null ? condition : Range.singleCharacter(unclosed));
    }

    private static ConditionKind leadingKind(String text) {
        Matcher matcher = LEADING_KEYWORD.matcher(text);
        if (matcher.find()) {
            return ConditionKind.fromKeyword(matcher.group(1)).orElse(ConditionKind.PATTERN);
        }
        return ConditionKind.PATTERN;
    }

    /**
     * Strips construct keywords until a plain pattern remains: {@code not( exists( $p : P() ) )}
     * gives {@code $p : P()}.
     */
    private String innermostPattern(ConditionKind kind, String text) {
        String current = TextUtils.constructBody(kind.keyword(), text);
        for (int i = 0; i < session.policy().maxNestingDepth(); i++) {
            ConditionKind nested = leadingKind(current);
            if (nested == ConditionKind.PATTERN) {
                break;
            }
            current = TextUtils.constructBody(nested.keyword(), current);
        }
        return current;
    }

    /**
     * First top-level {@code and}/{@code &&} or {@code or}/{@code ||} of {@code text}, if any.
     */
    private static ConditionKind connective(String text) {
        int[] depth = {0};
        ConditionKind[] found = {null};
        new CodeScanner().scan(text, (c, i) -> {
            if (found[0] != null) {
                return;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth[0]++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth[0]--;
            } else if (depth[0] == 0) {
                if (text.startsWith("&&", i) || isWordAt(text, i, "and")) {
                    found[0] = ConditionKind.AND;
                } else if (text.startsWith("||", i) || isWordAt(text, i, "or")) {
                    found[0] = ConditionKind.OR;
                }
            }
        });
        return found[0];
    }

    private static boolean isWordAt(String text, int i, String word) {
        int after = i + word.length();
        return text.startsWith(word, i)
                && (i == 0 || !Character.isJavaIdentifierPart(text.charAt(i - 1)))
                && (after == text.length() || !Character.isJavaIdentifierPart(text.charAt(after)));
    }

    /**
     * Maps offsets of the condition content, segment texts joined with {@code '\n'}, back to
     * document positions.
     */
    private record ContentMap(List<Segment> segments) {

        Position positionOf(int offset) {
            int remaining = offset;
            for (Segment segment : segments) {
                if (remaining <= segment.text().length()) {
                    return new Position(segment.line(), segment.column() + remaining);
                }
                remaining -= segment.text().length() + 1;
            }
            return segments.get(segments.size() - 1).end();
        }

        Range range(int from, int to) {
            return new Range(positionOf(from), positionOf(Math.max(from, to)));
        }
    }
}
