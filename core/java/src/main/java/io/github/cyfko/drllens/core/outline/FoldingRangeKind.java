package io.github.cyfko.drllens.core.outline;

/**
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FoldingRangeKind {
    REGION,
    COMMENT,
    IMPORTS
}
