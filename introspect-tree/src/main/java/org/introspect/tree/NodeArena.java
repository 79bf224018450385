package org.introspect.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only storage for tree nodes. A node is addressed by the index it was added at; replacing a subtree
 * means adding new nodes and pointing the parent (or the owner of the root) at the new index.
 */
public final class NodeArena {
    private final List<AbstractNode> nodes = new ArrayList<>();

    public int add(AbstractNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node is null");
        }
        nodes.add(node);
        return nodes.size() - 1;
    }

    public AbstractNode get(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IllegalArgumentException("No node at index " + index + " (arena size " + nodes.size() + ")");
        }
        return nodes.get(index);
    }

    public <T extends AbstractNode> T get(int index, Class<T> type) {
        AbstractNode node = get(index);
        if (!type.isInstance(node)) {
            throw new IllegalStateException("Node " + index + " is " + node.getKind() + ", expected "
                    + type.getSimpleName());
        }
        return type.cast(node);
    }

    public NodeKind kind(int index) {
        return get(index).getKind();
    }

    public CType type(int index) {
        return get(index).getType();
    }

    public int size() {
        return nodes.size();
    }

    public int variable(VarDecl decl) {
        return add(new VarRefNode(decl));
    }

    public int integer(CType type, long value) {
        return add(new IntegerConstantNode(type, value));
    }

    public int integer(long value) {
        return integer(CType.INT, value);
    }

    public int nullPointer(CType pointerType) {
        if (!pointerType.canonical().isPointer()) {
            throw new IllegalArgumentException("Not a pointer type: " + pointerType);
        }
        return integer(pointerType, 0);
    }

    public int string(String value) {
        return add(new StringConstantNode(value));
    }

    public int binary(NodeKind kind, CType type, int left, int right) {
        return add(new BinaryNode(kind, type, left, right));
    }

    /**
     * Relational or logical operator, which always yields {@code int} in C.
     */
    public int compare(NodeKind kind, int left, int right) {
        return binary(kind, CType.INT, left, right);
    }

    public int call(FunctionDecl function, int... arguments) {
        return add(new CallNode(function, arguments));
    }

    public int convert(CType type, int operand) {
        return add(new ConversionNode(type, operand));
    }

    public int addressOf(int operand) {
        return add(new AddressOfNode(CType.pointerTo(type(operand)), operand));
    }

    public int save(int operand) {
        return add(new SaveNode(type(operand), operand));
    }

    public int conditional(int condition, int thenBranch, int elseBranch) {
        return add(new ConditionalNode(condition, thenBranch, elseBranch));
    }

    public int nop() {
        return add(new NopNode());
    }

    public int block(int... statements) {
        return add(new BlockNode(statements));
    }

    public int block(List<Integer> statements) {
        int[] indexes = new int[statements.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = statements.get(i);
        }
        return block(indexes);
    }

    public int declare(SyntheticLocal local) {
        return add(new LocalDeclNode(local));
    }

    public int reference(SyntheticLocal local) {
        return add(new LocalRefNode(local));
    }

    public int setFlag(SyntheticLocal flag) {
        return add(new FlagSetNode(flag));
    }

    public int append(BufferDescriptor buffer, FunctionDecl formatter, String format, int... arguments) {
        return add(new BufferAppendNode(buffer, formatter, format, arguments));
    }
}
