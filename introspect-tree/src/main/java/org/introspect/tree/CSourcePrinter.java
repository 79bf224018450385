package org.introspect.tree;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders trees as C source. Evaluate-once handles become temporaries declared ahead of the statement that
 * uses them: the first occurrence assigns the temporary, later ones read it.
 */
public final class CSourcePrinter {
    private static final String INDENT = "    ";
    private static final String TEMP_PREFIX = "__ai_s";

    private final NodeArena arena;
    private final Map<Integer, String> tempNames = new HashMap<>();
    private final Set<Integer> assignedTemps = new HashSet<>();

    public CSourcePrinter(NodeArena arena) {
        this.arena = arena;
    }

    public String printFunction(FunctionDefinition definition) {
        FunctionDecl decl = definition.getDecl();
        StringBuilder sb = new StringBuilder();
        sb.append(decl.getReturnType().declare(decl.getName())).append('(');
        List<VarDecl> params = definition.getParameters();
        if (params.isEmpty()) {
            sb.append("void");
        }
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(params.get(i).getType().declare(params.get(i).getName()));
        }
        sb.append(") ");
        int body = definition.getBody();
        if (arena.kind(body) == NodeKind.BLOCK) {
            sb.append(printStatement(body, 0));
        } else {
            sb.append("{\n").append(printStatement(body, 1)).append("}\n");
        }
        return sb.toString();
    }

    public String printStatement(int index) {
        return printStatement(index, 0);
    }

    public String printStatement(int index, int depth) {
        Map<Integer, CType> temps = new LinkedHashMap<>();
        collectTemps(index, temps, new HashSet<>());
        temps.keySet().removeAll(tempNames.keySet());
        StringBuilder sb = new StringBuilder();
        if (temps.isEmpty()) {
            appendStatement(sb, index, depth);
            return sb.toString();
        }
        indent(sb, depth).append("{\n");
        for (Map.Entry<Integer, CType> temp : temps.entrySet()) {
            String name = TEMP_PREFIX + tempNames.size();
            tempNames.put(temp.getKey(), name);
            indent(sb, depth + 1).append(temp.getValue().declare(name)).append(";\n");
        }
        appendStatement(sb, index, depth + 1);
        indent(sb, depth).append("}\n");
        return sb.toString();
    }

    public String printExpression(int index) {
        StringBuilder sb = new StringBuilder();
        appendExpression(sb, index);
        return sb.toString();
    }

    private void collectTemps(int index, Map<Integer, CType> temps, Set<Integer> visited) {
        if (!visited.add(index)) {
            return;
        }
        AbstractNode node = arena.get(index);
        if (node.getKind() == NodeKind.SAVE) {
            temps.putIfAbsent(index, node.getType());
        }
        for (int operand : node.operands()) {
            collectTemps(operand, temps, visited);
        }
    }

    private void appendStatement(StringBuilder sb, int index, int depth) {
        AbstractNode node = arena.get(index);
        switch (node.getKind()) {
            case NOP:
                indent(sb, depth).append(";\n");
                return;
            case BLOCK: {
                BlockNode block = (BlockNode) node;
                indent(sb, depth).append("{\n");
                for (int i = 0; i < block.size(); i++) {
                    appendStatement(sb, block.statement(i), depth + 1);
                }
                indent(sb, depth).append("}\n");
                return;
            }
            case CONDITIONAL: {
                ConditionalNode conditional = (ConditionalNode) node;
                indent(sb, depth).append("if (");
                appendExpression(sb, conditional.condition);
                sb.append(")\n");
                appendBranch(sb, conditional.thenBranch, depth);
                if (arena.kind(conditional.elseBranch) != NodeKind.NOP) {
                    indent(sb, depth).append("else\n");
                    appendBranch(sb, conditional.elseBranch, depth);
                }
                return;
            }
            case LOCAL_DECL: {
                SyntheticLocal local = ((LocalDeclNode) node).local;
                if (local.getKind() == SyntheticLocal.Kind.BUFFER) {
                    indent(sb, depth).append("char ").append(local.getName())
                            .append('[').append(local.getCapacity()).append("] = {0};\n");
                } else {
                    indent(sb, depth).append("int ").append(local.getName()).append(" = 0;\n");
                }
                return;
            }
            case FLAG_SET:
                indent(sb, depth).append(((FlagSetNode) node).flag.getName()).append(" = 1;\n");
                return;
            case BUFFER_APPEND:
                appendBufferWrite(sb, (BufferAppendNode) node, depth);
                return;
            default:
                indent(sb, depth);
                appendExpression(sb, index);
                sb.append(";\n");
        }
    }

    private void appendBranch(StringBuilder sb, int index, int depth) {
        if (arena.kind(index) == NodeKind.BLOCK) {
            appendStatement(sb, index, depth);
        } else {
            appendStatement(sb, index, depth + 1);
        }
    }

    private void appendBufferWrite(StringBuilder sb, BufferAppendNode append, int depth) {
        String buffer = append.buffer.getBuffer().getName();
        String cursor = append.buffer.getCursor().getName();
        indent(sb, depth).append(cursor).append(" += ").append(append.formatter.getName()).append('(')
                .append(buffer).append(" + ").append(cursor).append(", sizeof(").append(buffer).append(") - ")
                .append(cursor).append(", ").append(quote(append.format));
        for (int i = 0; i < append.argumentCount(); i++) {
            sb.append(", ");
            appendExpression(sb, append.argument(i));
        }
        sb.append(");\n");
        indent(sb, depth).append("if (").append(cursor).append(" >= (int) sizeof(").append(buffer).append("))\n");
        indent(sb, depth + 1).append(cursor).append(" = (int) sizeof(").append(buffer).append(") - 1;\n");
    }

    private void appendExpression(StringBuilder sb, int index) {
        AbstractNode node = arena.get(index);
        switch (node.getKind()) {
            case VAR_REF:
                sb.append(((VarRefNode) node).decl.getName());
                return;
            case LOCAL_REF:
                sb.append(((LocalRefNode) node).local.getName());
                return;
            case INTEGER_CST:
                appendInteger(sb, (IntegerConstantNode) node);
                return;
            case STRING_CST:
                sb.append(quote(((StringConstantNode) node).value));
                return;
            case ADDR:
                sb.append('&');
                appendOperand(sb, ((AddressOfNode) node).operand);
                return;
            case CONVERT:
                sb.append('(').append(node.getType().displayName()).append(')');
                appendOperand(sb, ((ConversionNode) node).operand);
                return;
            case SAVE: {
                String name = tempNames.get(index);
                if (name == null) {
                    throw new IllegalStateException("Evaluate-once handle " + index + " has no temporary; print it through printStatement");
                }
                if (assignedTemps.add(index)) {
                    sb.append('(').append(name).append(" = ");
                    appendExpression(sb, ((SaveNode) node).operand);
                    sb.append(')');
                } else {
                    sb.append(name);
                }
                return;
            }
            case CALL: {
                CallNode call = (CallNode) node;
                sb.append(call.function.getName()).append('(');
                for (int i = 0; i < call.argumentCount(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    appendExpression(sb, call.argument(i));
                }
                sb.append(')');
                return;
            }
            default:
                if (node.getKind().isBinary()) {
                    BinaryNode binary = (BinaryNode) node;
                    appendChild(sb, binary.left, node.getKind(), false);
                    sb.append(' ').append(node.getKind().getOperator()).append(' ');
                    appendChild(sb, binary.right, node.getKind(), true);
                    return;
                }
                throw new IllegalStateException("Node " + index + " of kind " + node.getKind()
                        + " cannot appear in an expression");
        }
    }

    private void appendChild(StringBuilder sb, int child, NodeKind parent, boolean right) {
        NodeKind kind = arena.kind(child);
        boolean parenthesize = kind.isBinary()
                && (kind.getPrecedence() < parent.getPrecedence()
                || (right && kind.getPrecedence() == parent.getPrecedence()));
        if (parenthesize) {
            sb.append('(');
        }
        appendExpression(sb, child);
        if (parenthesize) {
            sb.append(')');
        }
    }

    private void appendOperand(StringBuilder sb, int operand) {
        boolean parenthesize = arena.kind(operand).isBinary();
        if (parenthesize) {
            sb.append('(');
        }
        appendExpression(sb, operand);
        if (parenthesize) {
            sb.append(')');
        }
    }

    private void appendInteger(StringBuilder sb, IntegerConstantNode constant) {
        CType type = constant.getType().canonical();
        if (type.isPointer()) {
            sb.append("((").append(constant.getType().displayName()).append(')').append(constant.value).append(')');
            return;
        }
        sb.append(type.isUnsigned() && constant.value < 0 ? Long.toUnsignedString(constant.value) : constant.value);
        String name = type.getName();
        if ("unsigned int".equals(name)) {
            sb.append('U');
        } else if ("long".equals(name)) {
            sb.append('L');
        } else if ("unsigned long".equals(name)) {
            sb.append("UL");
        } else if ("long long".equals(name)) {
            sb.append("LL");
        } else if ("unsigned long long".equals(name)) {
            sb.append("ULL");
        }
    }

    private StringBuilder indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        return sb;
    }

    /**
     * Quotes a value as a C string literal.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }
}
