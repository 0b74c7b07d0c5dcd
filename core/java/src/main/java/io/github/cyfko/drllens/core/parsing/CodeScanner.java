package io.github.cyfko.drllens.core.parsing;

/**
 * Character walker that reports only code characters.
 * <p>
 * String and character literals ({@code "..."}, {@code '...'}, backslash escapes honoured),
 * {@code //} comments and {@code /* ... *}{@code /} comments are skipped. Block comment state
 * survives from one {@link #scan} call to the next, so one scanner instance is fed a document
 * line after line. Block comments do not nest: the first {@code *}{@code /} closes them.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CodeScanner {

    private boolean inBlockComment;

    public boolean inBlockComment() {
        return inBlockComment;
    }

    /**
     * Visits the code characters of {@code line} in {@code [from, to)}.
     *
     * @param line    the text to scan
     * @param from    first column
     * @param to      column after the last one
     * @param visitor receives each code character with its column
     */
    public void scan(String line, int from, int to, CodeVisitor visitor) {
        char quote = 0;
        boolean escaped = false;
        for (int i = from; i < to; i++) {
            char c = line.charAt(i);
            if (inBlockComment) {
                if (c == '*' && i + 1 < to && line.charAt(i + 1) == '/') {
                    inBlockComment = false;
                    i++;
                }
                continue;
            }
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
            if (c == '"' || c == '\'') {
                quote = c;
                continue;
            }
            if (c == '/' && i + 1 < to) {
                char next = line.charAt(i + 1);
                if (next == '/') {
                    return;
                }
                if (next == '*') {
                    inBlockComment = true;
                    i++;
                    continue;
                }
            }
            visitor.visit(c, i);
        }
    }

    public void scan(String line, CodeVisitor visitor) {
        scan(line, 0, line.length(), visitor);
    }

    /**
     * Returns {@code line} with every block comment character, delimiters included, replaced by
     * a space. Columns are preserved; string literals and {@code //} comments are left alone.
     * Advances the block comment state like {@link #scan}.
     */
    public String maskBlockComments(String line) {
        char[] chars = line.toCharArray();
        char quote = 0;
        boolean escaped = false;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (inBlockComment) {
                chars[i] = ' ';
                if (c == '*' && i + 1 < chars.length && chars[i + 1] == '/') {
                    chars[++i] = ' ';
                    inBlockComment = false;
                }
                continue;
            }
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
            if (c == '"' || c == '\'') {
                quote = c;
                continue;
            }
            if (c == '/' && i + 1 < chars.length) {
                if (chars[i + 1] == '/') {
                    break;
                }
                if (chars[i + 1] == '*') {
                    chars[i] = ' ';
                    chars[++i] = ' ';
                    inBlockComment = true;
                }
            }
        }
        return new String(chars);
    }

    /**
     * Column where a trailing {@code //} comment starts, or the line length.
     * Uses a fresh state: {@code line} is assumed to start outside any block comment.
     */
    public static int codeEnd(String line) {
        int comment = findLineComment(line);
        return comment >= 0 ? comment : line.length();
    }

    private static int findLineComment(String line) {
        char quote = 0;
        boolean escaped = false;
        boolean block = false;
        for (int i = 0; i + 1 < line.length(); i++) {
            char c = line.charAt(i);
            if (block) {
                if (c == '*' && line.charAt(i + 1) == '/') {
                    block = false;
                    i++;
                }
            } else if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '/' && line.charAt(i + 1) == '/') {
                return i;
            } else if (c == '/' && line.charAt(i + 1) == '*') {
                block = true;
                i++;
            }
        }
        return -1;
    }

    @FunctionalInterface
    public interface CodeVisitor {
        void visit(char c, int column);
    }
}
