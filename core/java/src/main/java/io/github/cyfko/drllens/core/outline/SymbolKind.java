package io.github.cyfko.drllens.core.outline;

/**
 * Kind of a {@link DocumentSymbol}, named after the editor symbol kinds it maps to.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SymbolKind {
    PACKAGE,
    NAMESPACE,
    MODULE,
    VARIABLE,
    /** Rules. */
    FUNCTION,
    /** DRL functions. */
    METHOD,
    INTERFACE,
    CLASS,
    PROPERTY,
    OBJECT,
    FIELD,
    /** Conditions built on a construct keyword such as {@code exists}. */
    CONSTRUCTOR
}
