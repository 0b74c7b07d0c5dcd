package io.github.cyfko.drllens.core.parsing;

/**
 * A construct name read from a header line: either a double-quoted string or a bare identifier.
 *
 * @param name  the name, quotes removed and {@code \"} unescaped
 * @param start column of the first character (the quote for quoted names)
 * @param end   column after the last character
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NameToken(String name, int start, int end) {

    /**
     * Reads a name starting at or after {@code from}. A quoted form is tried first.
     *
     * @return the name, or {@code null} when neither form is present
     */
    public static NameToken read(String line, int from) {
        int i = from;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        if (i >= line.length()) {
            return null;
        }
        if (line.charAt(i) == '"') {
            StringBuilder name = new StringBuilder();
            for (int j = i + 1; j < line.length(); j++) {
                char c = line.charAt(j);
                if (c == '\\' && j + 1 < line.length()) {
                    name.append(line.charAt(++j));
                } else if (c == '"') {
                    return new NameToken(name.toString(), i, j + 1);
                } else {
                    name.append(c);
                }
            }
            return null;
        }
        if (!Character.isJavaIdentifierStart(line.charAt(i)) || line.charAt(i) == '$') {
            return null;
        }
        int j = i + 1;
        while (j < line.length() && Character.isJavaIdentifierPart(line.charAt(j))) {
            j++;
        }
        return new NameToken(line.substring(i, j), i, j);
    }
}
