package io.github.cyfko.drllens.core.model;

/**
 * The {@code package} declaration.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PackageNode(String name, Range range) {

    public PackageNode shiftLines(int delta) {
        return delta == 0 ? this : new PackageNode(name, range.shiftLines(delta));
    }
}
