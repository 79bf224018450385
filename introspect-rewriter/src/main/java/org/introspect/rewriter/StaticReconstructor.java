package org.introspect.rewriter;

import org.introspect.tree.AbstractNode;
import org.introspect.tree.AddressOfNode;
import org.introspect.tree.BinaryNode;
import org.introspect.tree.CSourcePrinter;
import org.introspect.tree.CallNode;
import org.introspect.tree.ConversionNode;
import org.introspect.tree.IntegerConstantNode;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.SaveNode;
import org.introspect.tree.StringConstantNode;
import org.introspect.tree.VarRefNode;

/**
 * Source text of an assertion condition, rebuilt from the tree. Variable and call names carry the color
 * their values get in the runtime report.
 */
public final class StaticReconstructor {
    private final NodeArena arena;
    private final ColorAllocator colors;
    private final boolean showCasts;

    public StaticReconstructor(NodeArena arena, ColorAllocator colors, boolean showCasts) {
        this.arena = arena;
        this.colors = colors;
        this.showCasts = showCasts;
    }

    public String reconstruct(int index) {
        StringBuilder sb = new StringBuilder();
        append(sb, index);
        return sb.toString();
    }

    private void append(StringBuilder sb, int index) {
        AbstractNode node = arena.get(index);
        switch (node.getKind()) {
            case SAVE:
                append(sb, ((SaveNode) node).operand);
                return;
            case CONVERT: {
                int operand = ((ConversionNode) node).operand;
                if (showCasts) {
                    sb.append('(').append(node.getType().displayName()).append(')');
                    appendOperand(sb, operand);
                } else {
                    append(sb, operand);
                }
                return;
            }
            case VAR_REF:
                sb.append(Color.paint(colors.assign(EntityIdentity.of(arena, index)),
                        ((VarRefNode) node).decl.getName()));
                return;
            case CALL: {
                CallNode call = (CallNode) node;
                sb.append(Color.paint(colors.assign(EntityIdentity.of(arena, index)), call.function.getName()));
                sb.append('(');
                for (int i = 0; i < call.argumentCount(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    append(sb, call.argument(i));
                }
                sb.append(')');
                return;
            }
            case INTEGER_CST:
                sb.append(literal((IntegerConstantNode) node));
                return;
            case STRING_CST:
                sb.append(CSourcePrinter.quote(((StringConstantNode) node).value));
                return;
            case ADDR:
                sb.append('&');
                appendOperand(sb, ((AddressOfNode) node).operand);
                return;
            default:
                if (node.getKind().isBinary()) {
                    appendBinary(sb, (BinaryNode) node);
                    return;
                }
                throw new IllegalStateException("Node " + index + " of kind " + node.getKind()
                        + " cannot appear in an assertion condition");
        }
    }

    private void appendBinary(StringBuilder sb, BinaryNode binary) {
        NodeKind kind = binary.getKind();
        if (kind.isLogical()) {
            sb.append('(');
            append(sb, binary.left);
            sb.append(") ").append(kind.getOperator()).append(" (");
            append(sb, binary.right);
            sb.append(')');
            return;
        }
        appendChild(sb, binary.left, kind, false);
        sb.append(' ').append(kind.getOperator()).append(' ');
        appendChild(sb, binary.right, kind, true);
    }

    private void appendChild(StringBuilder sb, int child, NodeKind parent, boolean right) {
        if (needsParentheses(arena, child, parent, right)) {
            sb.append('(');
            append(sb, child);
            sb.append(')');
        } else {
            append(sb, child);
        }
    }

    private void appendOperand(StringBuilder sb, int operand) {
        if (arena.kind(EntityIdentity.unwrap(arena, operand)).isBinary()) {
            sb.append('(');
            append(sb, operand);
            sb.append(')');
        } else {
            append(sb, operand);
        }
    }

    /**
     * Whether a binary child has to be parenthesized under its parent operator. Logical children are always
     * parenthesized since the report prints them with their own parentheses inside.
     */
    static boolean needsParentheses(NodeArena arena, int child, NodeKind parent, boolean right) {
        NodeKind kind = arena.kind(EntityIdentity.unwrap(arena, child));
        if (!kind.isBinary()) {
            return false;
        }
        return kind.isLogical()
                || kind.getPrecedence() < parent.getPrecedence()
                || (right && kind.getPrecedence() == parent.getPrecedence());
    }

    static String literal(IntegerConstantNode constant) {
        if (constant.isNullPointer()) {
            return "NULL";
        }
        if (constant.getType().canonical().isUnsigned() && constant.value < 0) {
            return Long.toUnsignedString(constant.value);
        }
        return Long.toString(constant.value);
    }
}
