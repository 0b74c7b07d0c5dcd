package io.github.cyfko.drllens.core.model;

/**
 * An {@code import}, {@code import static} or {@code import function} declaration.
 *
 * @param path           imported name, possibly ending with {@code .*}
 * @param staticImport   {@code true} for {@code import static}
 * @param functionImport {@code true} for {@code import function}
 * @param range          span of the declaration
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ImportNode(String path, boolean staticImport, boolean functionImport, Range range) {

    public ImportNode shiftLines(int delta) {
        return delta == 0 ? this : new ImportNode(path, staticImport, functionImport, range.shiftLines(delta));
    }
}
