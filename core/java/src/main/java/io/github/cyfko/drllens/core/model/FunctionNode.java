package io.github.cyfko.drllens.core.model;

import java.util.List;

/**
 * A {@code function ReturnType name(params) { ... }} declaration.
 *
 * @param returnType declared return type
 * @param name       function name
 * @param parameters parameters in declaration order
 * @param body       raw text between the outermost braces
 * @param range      from the {@code function} keyword to the closing brace
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionNode(String returnType, String name, List<ParameterNode> parameters, String body, Range range) {

    public FunctionNode {
        parameters = List.copyOf(parameters);
    }

    public FunctionNode shiftLines(int delta) {
        return delta == 0 ? this : new FunctionNode(returnType, name,
                parameters.stream().map(p -> p.shiftLines(delta)).toList(), body, range.shiftLines(delta));
    }
}
