package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.ConditionNode;
import io.github.cyfko.drllens.core.model.ParameterNode;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.QueryNode;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code query "name" (Type param, ...) <conditions> end}. The body is read like a
 * {@code when} clause.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class QueryParser {

    private final ParseSession session;
    private final ConditionParser conditions;

    QueryParser(ParseSession session) {
        this.session = session;
        this.conditions = new ConditionParser(session);
    }

    ParseOutcome<QueryNode> parse(ParseCursor cursor) {
        String line = cursor.text();
        int codeEnd = CodeScanner.codeEnd(line);
        int keywordEnd = cursor.indent() + "query".length();
        NameToken token = NameToken.read(line, keywordEnd);
        String name;
        int nameEnd;
        if (token == null || token.end() > codeEnd) {
            session.error("Invalid query declaration: expected query \"<name>\"", cursor.contentRange());
            name = "";
            String rest = line.substring(Math.min(keywordEnd, codeEnd), codeEnd).trim();
            nameEnd = rest.isEmpty() || rest.startsWith("(") ? keywordEnd : codeEnd;
        } else {
            name = token.name();
            nameEnd = token.end();
        }

        List<ParameterNode> parameters = new ArrayList<>();
        int headerEnd = nameEnd;
        String rest = line.substring(Math.min(nameEnd, codeEnd), codeEnd);
        if (rest.trim().startsWith("(")) {
            int open = line.indexOf('(', nameEnd);
            int close = TextUtils.findClosingParenthesis(line, open);
            if (close < 0 || close >= codeEnd) {
                return ParseOutcome.failure("Invalid query declaration: missing ')' after the parameters of '" + name + "'",
                        cursor.contentRange());
            }
            String invalid = FunctionParser.parseParameters(line, open + 1, close, cursor.line(), parameters);
            if (invalid != null) {
                session.warning("Invalid parameter '" + invalid + "' in query '" + name + "'", cursor.contentRange());
            }
            headerEnd = close + 1;
        }

        SegmentReader reader = new SegmentReader(cursor.source(), cursor.line(), headerEnd, new Position(cursor.line(), headerEnd));
        List<ConditionNode> nodes = new ArrayList<>();
        Segment segment;
        while ((segment = reader.peek()) != null && !segment.isKeyword("end")) {
            if (reader.atLineStart() && TopLevelKeyword.looksLikeHeader(segment.text())) {
                break;
            }
            nodes.add(conditions.parse(reader));
        }

        Position end;
        if (segment != null && segment.isKeyword("end")) {
            reader.advance();
            end = segment.end();
        } else {
            end = reader.lastEnd();
            session.error("Expected 'end' to close query \"" + name + "\"", Range.point(end));
            if (segment == null) {
                session.markUnterminated();
            }
        }
        QueryNode query = new QueryNode(name, parameters, nodes, new Range(cursor.position(), end));
        return ParseOutcome.success(query, reader.resumeCursor());
    }
}
