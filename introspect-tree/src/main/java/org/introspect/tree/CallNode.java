package org.introspect.tree;

import java.util.Objects;

public final class CallNode extends AbstractNode {
    public final FunctionDecl function;
    private final int[] arguments;

    public CallNode(FunctionDecl function, int... arguments) {
        super(NodeKind.CALL, function.getReturnType());
        this.function = Objects.requireNonNull(function, "function");
        this.arguments = arguments.clone();
    }

    public int argumentCount() {
        return arguments.length;
    }

    public int argument(int index) {
        return arguments[index];
    }

    @Override
    public int[] operands() {
        return arguments.clone();
    }
}
