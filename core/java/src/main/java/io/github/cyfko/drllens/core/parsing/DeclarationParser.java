package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.GlobalNode;
import io.github.cyfko.drllens.core.model.ImportNode;
import io.github.cyfko.drllens.core.model.PackageNode;
import io.github.cyfko.drllens.core.model.Range;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-line declarations: {@code package}, {@code import} and {@code global}.
 * The trailing semicolon is optional, as in Drools. Import paths and global names are kept as
 * written; their conventions are checked by the semantic passes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DeclarationParser {

    private static final Pattern PACKAGE = Pattern.compile("^package\\s+([A-Za-z_][\\w.]*)\\s*;?$");
    private static final Pattern IMPORT = Pattern.compile("^import\\s+(?:(static|function)\\s+)?([^\\s;]+)\\s*;?$");
    private static final Pattern GLOBAL = Pattern.compile("^global\\s+([^;]*?)\\s*;?$");
    private static final Pattern TYPE_AND_NAME = Pattern.compile("^(?:(.*?)\\s+)?(\\S+)$");

    public ParseOutcome<PackageNode> parsePackage(ParseCursor cursor) {
        Matcher matcher = PACKAGE.matcher(code(cursor));
        if (!matcher.matches()) {
            return ParseOutcome.failure("Invalid package declaration", cursor.contentRange());
        }
        return ParseOutcome.success(new PackageNode(matcher.group(1), codeRange(cursor)), cursor.next());
    }

    public ParseOutcome<ImportNode> parseImport(ParseCursor cursor) {
        Matcher matcher = IMPORT.matcher(code(cursor));
        if (!matcher.matches()) {
            return ParseOutcome.failure("Invalid import declaration", cursor.contentRange());
        }
        String modifier = matcher.group(1);
        ImportNode node = new ImportNode(matcher.group(2), "static".equals(modifier), "function".equals(modifier), codeRange(cursor));
        return ParseOutcome.success(node, cursor.next());
    }

    public ParseOutcome<GlobalNode> parseGlobal(ParseCursor cursor) {
        Matcher matcher = GLOBAL.matcher(code(cursor));
        Matcher parts = matcher.matches() ? TYPE_AND_NAME.matcher(matcher.group(1)) : null;
        if (parts == null || !parts.matches()) {
            return ParseOutcome.failure("Invalid global declaration: expected 'global <Type> <name>'", cursor.contentRange());
        }
        GlobalNode node = parts.group(1) == null
                ? new GlobalNode(parts.group(2), "", codeRange(cursor))
                : new GlobalNode(parts.group(1).trim(), parts.group(2), codeRange(cursor));
        return ParseOutcome.success(node, cursor.next());
    }

    /**
     * Current line without indentation and trailing {@code //} comment.
     */
    static String code(ParseCursor cursor) {
        String text = cursor.text();
        int start = cursor.indent();
        int end = CodeScanner.codeEnd(text);
        return end <= start ? "" : text.substring(start, end).trim();
    }

    static Range codeRange(ParseCursor cursor) {
        int start = cursor.indent();
        return Range.of(cursor.line(), start, cursor.line(), start + code(cursor).length());
    }
}
