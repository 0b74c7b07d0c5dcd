package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.FunctionNode;
import io.github.cyfko.drllens.core.model.ParameterNode;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code function ReturnType name(Type a, Type b) { ... }}.
 * <p>
 * The opening brace may sit on the signature line or start a following line. Braces are
 * counted outside literals and comments until the depth returns to zero; the body is the text
 * between the outermost braces. A body still open at the end of the document, or when a
 * construct header appears, is reported and the function is kept.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class FunctionParser {

    private static final Pattern HEADER = Pattern.compile("^function\\b\\s*([^(]*)\\(");
    private static final Pattern SIGNATURE = Pattern.compile("^(?:(.*?)\\s+)?([A-Za-z_]\\w*)$");
    private static final Pattern TYPE = Pattern.compile("^[A-Za-z_][\\w.]*(?:<.*>)?(?:\\[\\])*(?:\\.\\.\\.)?$");
    private static final Pattern PARAMETER = Pattern.compile("^(?:final\\s+)?([A-Za-z_][\\w.]*(?:<.*>)?(?:\\[\\])*(?:\\.\\.\\.)?)\\s+([A-Za-z_]\\w*)$");
    private static final Set<String> PRIMITIVES = Set.of("void", "boolean", "byte", "char", "short", "int", "long", "float", "double");

    private final ParseSession session;

    FunctionParser(ParseSession session) {
        this.session = session;
    }

    ParseOutcome<FunctionNode> parse(ParseCursor cursor) {
        String line = cursor.text();
        int indent = cursor.indent();
        int codeEnd = CodeScanner.codeEnd(line);
        Matcher header = HEADER.matcher(line.substring(indent, Math.max(indent, codeEnd)));
        String[] signature = header.find() ? splitSignature(header.group(1).trim()) : null;
        if (signature == null) {
            return ParseOutcome.failure("Invalid function declaration: expected 'function <ReturnType> <name>(<parameters>)'",
                    cursor.contentRange());
        }
        String returnType = signature[0];
        String name = signature[1];
        if (name.isEmpty()) {
            session.error("Invalid function declaration: missing function name", cursor.contentRange());
        }
        if (returnType.isEmpty()) {
            session.error("Invalid function declaration: missing return type of function '" + name + "'", cursor.contentRange());
        }
        int openParen = indent + header.end() - 1;
        int closeParen = TextUtils.findClosingParenthesis(line, openParen);
        if (closeParen < 0 || closeParen >= codeEnd) {
            return ParseOutcome.failure("Invalid function declaration: missing ')' after the parameters of '" + name + "'",
                    cursor.contentRange());
        }

        List<ParameterNode> parameters = new ArrayList<>();
        String invalid = parseParameters(line, openParen + 1, closeParen, cursor.line(), parameters);
        if (invalid != null) {
            session.warning("Invalid parameter '" + invalid + "' in function '" + name + "'", cursor.contentRange());
        }

        String afterParameters = line.substring(closeParen + 1, codeEnd).trim();
        ParseCursor braceCursor;
        int braceColumn;
        if (afterParameters.startsWith("{")) {
            braceCursor = cursor;
            braceColumn = line.indexOf('{', closeParen + 1);
        } else if (afterParameters.isEmpty()) {
            braceCursor = cursor.next().skipTrivia();
            if (braceCursor.atEnd() || !braceCursor.trimmed().startsWith("{")) {
                return ParseOutcome.failure("Expected '{' to open the body of function '" + name + "'", cursor.contentRange());
            }
            braceColumn = braceCursor.indent();
        } else {
            return ParseOutcome.failure("Unexpected '" + TextUtils.abbreviate(afterParameters) + "' after the parameters of function '"
                    + name + "'", cursor.contentRange());
        }
        return readBody(cursor, braceCursor, braceColumn, returnType, name, parameters);
    }

    private ParseOutcome<FunctionNode> readBody(ParseCursor header, ParseCursor braceCursor, int braceColumn,
                                                String returnType, String name, List<ParameterNode> parameters) {
        SourceLines source = header.source();
        CodeScanner scanner = new CodeScanner();
        int[] depth = {0};
        int[] close = {-1};
        int line = braceCursor.line();
        int lastLine = line;
        for (; line < source.size(); line++) {
            String text = source.line(line);
            if (line > braceCursor.line() && TopLevelKeyword.looksLikeHeader(text.trim())) {
                break;
            }
            lastLine = line;
            int from = line == braceCursor.line() ? braceColumn : 0;
            scanner.scan(text, from, text.length(), (c, column) -> {
                if (close[0] >= 0) {
                    return;
                }
                if (c == '{') {
                    depth[0]++;
                } else if (c == '}' && --depth[0] == 0) {
                    close[0] = column;
                }
            });
            if (close[0] >= 0) {
                break;
            }
        }

        Position start = header.position();
        Position bodyStart = new Position(braceCursor.line(), braceColumn + 1);
        if (close[0] < 0) {
            Position end = new Position(lastLine, source.line(lastLine).length());
            Range range = new Range(start, end);
            session.error("Unterminated body of function '" + name + "': missing '}'", range);
            if (line >= source.size()) {
                session.markUnterminated();
            }
            String body = textBetween(source, bodyStart, end);
            return ParseOutcome.success(new FunctionNode(returnType, name, parameters, body, range), header.at(lastLine + 1));
        }
        Position closing = new Position(lastLine, close[0]);
        Range range = new Range(start, new Position(lastLine, close[0] + 1));
        return ParseOutcome.success(new FunctionNode(returnType, name, parameters, textBetween(source, bodyStart, closing), range),
                header.at(lastLine + 1));
    }

    /**
     * Splits the text between {@code function} and {@code (} into return type and name. Either
     * part may come back empty; a lone primitive or {@code void} is taken as the return type.
     *
     * @return {@code [returnType, name]}, or {@code null} when the return type is malformed
     */
    private static String[] splitSignature(String signature) {
        if (signature.isEmpty()) {
            return new String[]{"", ""};
        }
        Matcher matcher = SIGNATURE.matcher(signature);
        String returnType;
        String name;
        if (!matcher.matches()) {
            returnType = signature;
            name = "";
        } else if (matcher.group(1) == null) {
            boolean primitive = PRIMITIVES.contains(matcher.group(2));
            returnType = primitive ? matcher.group(2) : "";
            name = primitive ? "" : matcher.group(2);
        } else {
            returnType = matcher.group(1).trim();
            name = matcher.group(2);
        }
        return returnType.isEmpty() || TYPE.matcher(returnType).matches() ? new String[]{returnType, name} : null;
    }

    /**
     * Parses the parameter list into {@code sink}. A part holding only a type, or nothing at
     * all, is kept with the missing pieces left empty; anything else that does not read as
     * {@code Type name} is skipped.
     *
     * @return the first invalid parameter text, or {@code null} when all are valid
     */
    static String parseParameters(String line, int from, int to, int lineNumber, List<ParameterNode> sink) {
        if (line.substring(from, to).isBlank()) {
            return null;
        }
        String invalid = null;
        int depth = 0;
        int partStart = from;
        for (int i = from; i <= to; i++) {
            char c = i < to ? line.charAt(i) : ',';
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth <= 0) {
                String raw = line.substring(partStart, i);
                String part = raw.trim();
                int column = partStart + TextUtils.indentOf(raw);
                Range range = Range.of(lineNumber, column, lineNumber, column + part.length());
                Matcher matcher = PARAMETER.matcher(part);
                if (matcher.matches()) {
                    sink.add(new ParameterNode(matcher.group(1), matcher.group(2), range));
                } else if (part.isEmpty() || TYPE.matcher(part).matches()) {
                    sink.add(new ParameterNode(part, "", range));
                } else if (invalid == null) {
                    invalid = part;
                }
                partStart = i + 1;
            }
        }
        return invalid;
    }

    private static String textBetween(SourceLines source, Position from, Position to) {
        if (from.line() == to.line()) {
            String line = source.raw(from.line());
            int start = Math.min(from.character(), line.length());
            return line.substring(start, Math.max(start, Math.min(to.character(), line.length()))).strip();
        }
        StringBuilder text = new StringBuilder();
        String first = source.raw(from.line());
        text.append(first.substring(Math.min(from.character(), first.length())));
        for (int line = from.line() + 1; line < to.line(); line++) {
            text.append('\n').append(source.raw(line));
        }
        String last = source.raw(to.line());
        text.append('\n').append(last, 0, Math.min(to.character(), last.length()));
        return text.toString().strip();
    }
}
