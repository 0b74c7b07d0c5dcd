package io.github.cyfko.drllens.core.outline;

import io.github.cyfko.drllens.core.model.Range;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the document outline.
 *
 * @param name     display name
 * @param kind     symbol kind
 * @param range    full span of the symbol
 * @param children nested symbols in document order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DocumentSymbol(String name, SymbolKind kind, Range range, List<DocumentSymbol> children) {

    public DocumentSymbol {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(range, "range is required");
        children = List.copyOf(children);
    }

    public static DocumentSymbol leaf(String name, SymbolKind kind, Range range) {
        return new DocumentSymbol(name, kind, range, List.of());
    }
}
