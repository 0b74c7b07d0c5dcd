package io.github.cyfko.drllens.core.parsing;

import io.github.cyfko.drllens.core.model.DeclareNode;
import io.github.cyfko.drllens.core.model.FieldNode;
import io.github.cyfko.drllens.core.model.Position;
import io.github.cyfko.drllens.core.model.Range;
import io.github.cyfko.drllens.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a type declaration:
 * <pre>
 * declare Person extends Party
 *     &#64;role(fact)
 *     name : String &#64;key
 *     age : int = 18
 * end
 * </pre>
 * Annotation lines are skipped; enum declarations accept constant lines.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class DeclareParser {

    private static final Pattern HEADER = Pattern.compile(
            "^declare\\s+(?:(trait|enum)\\s+)?([A-Za-z_][\\w.]*)(?:\\s+extends\\s+([A-Za-z_][\\w.]*))?$");
    private static final Pattern NAMELESS = Pattern.compile("^declare(?:\\s+(trait|enum))?$");
    private static final Pattern FIELD_TYPE = Pattern.compile("^[A-Za-z_][\\w.]*(?:<.*>)?(?:\\[\\])*$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_]\\w*$");
    private static final Pattern ENUM_CONSTANT = Pattern.compile("^[A-Za-z_]\\w*\\s*(?:\\(.*\\))?\\s*[,;]?$");

    private final ParseSession session;

    DeclareParser(ParseSession session) {
        this.session = session;
    }

    ParseOutcome<DeclareNode> parse(ParseCursor cursor) {
        String code = DeclarationParser.code(cursor);
        Matcher header = HEADER.matcher(code);
        boolean enumeration;
        String name;
        String superType;
        if (header.matches()) {
            enumeration = "enum".equals(header.group(1));
            name = header.group(2);
            superType = header.group(3);
        } else {
            Matcher nameless = NAMELESS.matcher(code);
            if (!nameless.matches()) {
                return ParseOutcome.failure("Invalid declare statement: expected 'declare <TypeName>'", cursor.contentRange());
            }
            session.error("Invalid declare statement: expected 'declare <TypeName>'", cursor.contentRange());
            enumeration = "enum".equals(nameless.group(1));
            name = "";
            superType = null;
        }

        List<FieldNode> fields = new ArrayList<>();
        Position end = DeclarationParser.codeRange(cursor).end();
        ParseCursor current = cursor.next().skipTrivia();
        while (true) {
            if (current.atEnd() || TopLevelKeyword.looksLikeHeader(current.trimmed())) {
                session.error("Expected 'end' to close declaration of '" + name + "'", Range.point(end));
                if (current.atEnd()) {
                    session.markUnterminated();
                }
                return ParseOutcome.success(new DeclareNode(name, superType, fields, new Range(cursor.position(), end)), current);
            }
            String member = DeclarationParser.code(current);
            Range range = DeclarationParser.codeRange(current);
            if (member.equals("end")) {
                end = range.end();
                break;
            }
            if (!member.startsWith("@")) {
                FieldNode field = readField(member, range);
                if (field != null) {
                    fields.add(field);
                } else if (!(enumeration && ENUM_CONSTANT.matcher(member).matches())) {
                    session.warning("Unrecognized member '" + TextUtils.abbreviate(member) + "' in declaration of '" + name + "'", range);
                }
            }
            end = range.end();
            current = current.next().skipTrivia();
        }
        return ParseOutcome.success(new DeclareNode(name, superType, fields, new Range(cursor.position(), end)), current.next());
    }

    /**
     * Reads {@code name : Type}. Either side may be empty; the structural checks report it.
     */
    private static FieldNode readField(String code, Range range) {
        int colon = code.indexOf(':');
        if (colon < 0) {
            return null;
        }
        String fieldName = code.substring(0, colon).trim();
        String type = code.substring(colon + 1);
        int cut = type.length();
        for (char marker : new char[]{'@', '=', ';'}) {
            int index = type.indexOf(marker);
            if (index >= 0) {
                cut = Math.min(cut, index);
            }
        }
        type = type.substring(0, cut).trim();
        if (!fieldName.isEmpty() && !IDENTIFIER.matcher(fieldName).matches()
                || !type.isEmpty() && !FIELD_TYPE.matcher(type).matches()) {
            return null;
        }
        return new FieldNode(fieldName, type, range);
    }
}
