package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.ActionClause;
import io.github.cyfko.drllens.core.model.ConditionClause;
import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.model.RuleAttribute;
import io.github.cyfko.drllens.core.model.RuleNode;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a {@code rule "name" <attributes> when <conditions> then <actions> end} block.
 * <p>
 * The rule is always produced, even when broken: an unreadable header leaves the name empty,
 * unknown attribute lines are warnings, a missing {@code end} is an error and the rule stops
 * before the next construct header.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class RuleParser {

    private static final Pattern ATTRIBUTE = Pattern.compile("^([A-Za-z][\\w-]*)(?:\\s+(.+?))?\\s*;?$");

    private final ParseSession session;
    private final ConditionParser conditions;

    RuleParser(ParseSession session) {
        this.session = session;
        this.conditions = new ConditionParser(session);
    }

    ParseOutcome<RuleNode> parse(ParseCursor cursor) {
        String line = cursor.text();
        int keywordEnd = cursor.indent() + "rule".length();
        NameToken token = NameToken.read(line, keywordEnd);
        String name;
        int headerEnd;
        if (token == null) {
            session.error("Invalid rule declaration: expected rule \"<name>\"", cursor.contentRange());
            name = "";
            headerEnd = line.length();
        } else {
            name = token.name();
            headerEnd = token.end();
        }

        SegmentReader reader = new SegmentReader(cursor.source(), cursor.line(), headerEnd,
                new Position(cursor.line(), Math.min(headerEnd, line.stripTrailing().length())));

        List<RuleAttribute> attributes = readAttributes(reader);
        ConditionClause when = null;
        ActionClause then = null;
        Segment segment = reader.peek();
        if (segment != null && segment.isKeyword("when")) {
            when = readWhen(reader);
            segment = reader.peek();
        }
        if (segment != null && segment.isKeyword("then")) {
            then = readThen(reader);
            segment = reader.peek();
        }

        Position end;
        if (segment != null && segment.isKeyword("end")) {
            reader.advance();
            end = segment.end();
        } else {
            end = reader.lastEnd();
            session.error("Expected 'end' to close rule \"" + name + "\"", Range.point(end));
            if (segment == null) {
                session.markUnterminated();
            }
        }
        RuleNode rule = new RuleNode(name, attributes, when, then, new Range(cursor.position(), end));
        return ParseOutcome.success(rule, reader.resumeCursor());
    }

    private List<RuleAttribute> readAttributes(SegmentReader reader) {
        List<RuleAttribute> attributes = new ArrayList<>();
        Segment segment;
        while ((segment = reader.peek()) != null && !segment.isClauseKeyword()) {
            if (reader.atLineStart() && TopLevelKeyword.looksLikeHeader(segment.text())) {
                break;
            }
            reader.advance();
            if (segment.text().startsWith("@")) {
                continue;
            }
            Matcher matcher = ATTRIBUTE.matcher(segment.text());
            if (matcher.matches()) {
                attributes.add(new RuleAttribute(matcher.group(1), matcher.group(2), segment.range()));
            } else {
                session.warning("Unrecognized rule attribute '" + TextUtils.abbreviate(segment.text()) + "'", segment.range());
            }
        }
        return attributes;
    }

    private ConditionClause readWhen(SegmentReader reader) {
        Segment whenSegment = reader.advance();
        List<ConditionNode> nodes = new ArrayList<>();
        Position end = whenSegment.end();
        Segment segment;
        while ((segment = reader.peek()) != null) {
            if (segment.isKeyword("then") || segment.isKeyword("end")
                    || (reader.atLineStart() && TopLevelKeyword.looksLikeHeader(segment.text()))) {
                break;
            }
            if (segment.isKeyword("when")) {
                session.warning("Duplicate 'when' keyword", segment.range());
                reader.advance();
                continue;
            }
            ConditionNode node = conditions.parse(reader);
            nodes.add(node);
            end = node.range().end();
        }
        return new ConditionClause(nodes, new Range(whenSegment.start(), end));
    }

    /**
     * Collects the action text verbatim, line by line, up to the {@code end} segment.
     */
    private ActionClause readThen(SegmentReader reader) {
        Segment thenSegment = reader.advance();
        SourceLines source = reader.source();
        ActionText action = new ActionText(thenSegment.end());

        int line = thenSegment.line();
        String raw = source.raw(line);
        List<Segment> rest = reader.remainingOnLine();
        Segment endSegment = rest.isEmpty() || !rest.get(rest.size() - 1).isKeyword("end") ? null : rest.get(rest.size() - 1);
        int from = thenSegment.end().character();
        int to = endSegment != null ? endSegment.column() : raw.length();
        if (to > from && !raw.substring(from, to).isBlank()) {
            String head = raw.substring(from, to);
            int column = from + TextUtils.indentOf(head);
            action.add(line, column, head.strip());
        }
        if (endSegment != null) {
            reader.reposition(line, List.of(endSegment), false);
            return action.build(thenSegment, reader);
        }

        for (line = line + 1; line < source.size(); line++) {
            String text = source.line(line);
            List<Segment> segments = RuleSegmenter.split(text, line, 0);
            Segment last = segments.isEmpty() ? null : segments.get(segments.size() - 1);
            if (last != null && last.isKeyword("end")) {
                String prefix = source.raw(line).substring(0, last.column()).stripTrailing();
                if (!prefix.isBlank()) {
                    action.add(line, 0, prefix);
                }
                reader.reposition(line, List.of(last), prefix.isBlank());
                return action.build(thenSegment, reader);
            }
            if (TopLevelKeyword.looksLikeHeader(text.trim())) {
                reader.reposition(line, segments, true);
                return action.build(thenSegment, reader);
            }
            action.add(line, 0, source.raw(line));
        }
        reader.reposition(source.size() - 1, List.of(), false);
        return action.build(thenSegment, reader);
    }

    /**
     * Accumulates action lines; line {@code i} of the text is document line {@code start.line() + i}.
     */
    private static final class ActionText {
        private final List<String> lines = new ArrayList<>();
        private final Position emptyStart;
        private Position contentStart;
        private Position contentEnd;

        private ActionText(Position emptyStart) {
            this.emptyStart = emptyStart;
        }

        private void add(int line, int column, String text) {
            if (contentStart == null) {
                if (text.isBlank()) {
                    return;
                }
                contentStart = new Position(line, column);
            }
            lines.add(text);
            if (!text.isBlank()) {
                contentEnd = new Position(line, (lines.size() == 1 ? column : 0) + text.stripTrailing().length());
            }
        }

        private ActionClause build(Segment thenSegment, SegmentReader reader) {
            if (contentStart == null) {
                return new ActionClause("", emptyStart, thenSegment.range());
            }
            int last = lines.size() - 1;
            while (last > 0 && lines.get(last).isBlank()) {
                last--;
            }
            String text = String.join("\n", lines.subList(0, last + 1));
            reader.lastEnd(contentEnd);
            return new ActionClause(text, contentStart, new Range(thenSegment.start(), contentEnd));
        }
    }
}
