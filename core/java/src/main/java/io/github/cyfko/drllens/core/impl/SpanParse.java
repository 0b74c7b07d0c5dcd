package io.github.cyfko.drllens.core.impl;

import io.github.cyfko.drllens.core.model.ParseResult;

/**
 * A parse of a document or of a span of one.
 *
 * @param result       tree and errors
 * @param unterminated a construct reached the end of the text without being closed
 * @param fatal        the parse failed and {@code result} is the minimal tree
 */
record SpanParse(ParseResult result, boolean unterminated, boolean fatal) {
}
