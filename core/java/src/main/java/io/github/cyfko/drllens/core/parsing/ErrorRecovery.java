package io.github.cyfko.drllens.core.parsing;

/**
 * Resynchronisation after a failed construct.
 * <p>
 * Lines are skipped until one starts with a top-level keyword, where dispatch resumes, or
 * equals {@code end}, which closes the failed construct and is consumed with it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ErrorRecovery {

    private ErrorRecovery() {
    }

    /**
     * @param failed cursor on the line where the failed construct started
     * @return cursor on the next line where normal dispatch can resume
     */
    public static ParseCursor resynchronize(ParseCursor failed) {
        ParseCursor cursor = failed.next();
        while (!cursor.atEnd()) {
            String trimmed = cursor.trimmed();
            if (trimmed.equals("end")) {
                return cursor.next();
            }
            if (TopLevelKeyword.match(trimmed).isPresent()) {
                return cursor;
            }
            cursor = cursor.next();
        }
        return cursor;
    }
}
