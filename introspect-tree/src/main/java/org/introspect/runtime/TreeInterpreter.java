package org.introspect.runtime;

import org.introspect.tree.AbstractNode;
import org.introspect.tree.AddressOfNode;
import org.introspect.tree.BinaryNode;
import org.introspect.tree.BlockNode;
import org.introspect.tree.BufferAppendNode;
import org.introspect.tree.CType;
import org.introspect.tree.CallNode;
import org.introspect.tree.ConditionalNode;
import org.introspect.tree.ConversionNode;
import org.introspect.tree.FlagSetNode;
import org.introspect.tree.FunctionDefinition;
import org.introspect.tree.IntegerConstantNode;
import org.introspect.tree.LocalDeclNode;
import org.introspect.tree.LocalRefNode;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.SaveNode;
import org.introspect.tree.StringConstantNode;
import org.introspect.tree.SyntheticLocal;
import org.introspect.tree.TranslationUnit;
import org.introspect.tree.VarDecl;
import org.introspect.tree.VarRefNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes trees of a translation unit against an {@link Environment}. Integer arithmetic follows the
 * precision and signedness of the node types, logical operators short-circuit, and evaluate-once handles
 * capture their value on first evaluation. {@code printf}, {@code abort} and {@code __assert_fail} are
 * built in; every other callee must be defined in the environment.
 */
public final class TreeInterpreter {
    public static final String PRINTF = "printf";
    public static final String ABORT = "abort";
    public static final String ASSERT_FAIL = "__assert_fail";

    private final TranslationUnit unit;
    private final NodeArena arena;
    private final Environment environment;
    private final Map<Integer, Object> saved = new HashMap<>();
    private final Map<SyntheticLocal, Object> locals = new IdentityHashMap<>();

    public TreeInterpreter(TranslationUnit unit, Environment environment) {
        this.unit = unit;
        this.arena = unit.getArena();
        this.environment = environment;
    }

    /**
     * Runs a function defined in the unit with the given arguments. {@link Integer} and {@link String}
     * arguments are accepted for integer and {@code char *} parameters.
     */
    public void invoke(String function, Object... arguments) {
        FunctionDefinition definition = unit.findDefinition(function);
        if (definition == null) {
            throw new IllegalArgumentException("Function '" + function + "' is not defined in " + unit.getFileName());
        }
        List<VarDecl> parameters = definition.getParameters();
        if (parameters.size() != arguments.length) {
            throw new IllegalArgumentException("Function '" + function + "' takes " + parameters.size()
                    + " arguments, got " + arguments.length);
        }
        for (int i = 0; i < arguments.length; i++) {
            environment.bind(parameters.get(i), toValue(arguments[i]));
        }
        saved.clear();
        locals.clear();
        execute(definition.getBody());
    }

    public void execute(int index) {
        AbstractNode node = arena.get(index);
        switch (node.getKind()) {
            case NOP:
                return;
            case BLOCK: {
                BlockNode block = (BlockNode) node;
                for (int i = 0; i < block.size(); i++) {
                    execute(block.statement(i));
                }
                return;
            }
            case CONDITIONAL: {
                ConditionalNode conditional = (ConditionalNode) node;
                if (isTrue(evaluate(conditional.condition))) {
                    execute(conditional.thenBranch);
                } else {
                    execute(conditional.elseBranch);
                }
                return;
            }
            case LOCAL_DECL: {
                SyntheticLocal local = ((LocalDeclNode) node).local;
                locals.put(local, local.getKind() == SyntheticLocal.Kind.BUFFER
                        ? new char[local.getCapacity()] : (Object) 0L);
                return;
            }
            case FLAG_SET: {
                SyntheticLocal flag = ((FlagSetNode) node).flag;
                local(flag);
                locals.put(flag, 1L);
                return;
            }
            case BUFFER_APPEND:
                appendToBuffer((BufferAppendNode) node);
                return;
            default:
                evaluate(index);
        }
    }

    public Object evaluate(int index) {
        AbstractNode node = arena.get(index);
        switch (node.getKind()) {
            case VAR_REF:
                return convert(environment.value(((VarRefNode) node).decl), node.getType());
            case INTEGER_CST:
                return convert(((IntegerConstantNode) node).value, node.getType());
            case STRING_CST:
                return environment.stringConstant(index, ((StringConstantNode) node).value);
            case ADDR: {
                int operand = ((AddressOfNode) node).operand;
                if (arena.kind(operand) != NodeKind.VAR_REF) {
                    throw new IllegalStateException("Address of " + arena.kind(operand) + " is not supported");
                }
                return environment.addressOf(arena.get(operand, VarRefNode.class).decl);
            }
            case CONVERT:
                return convert(evaluate(((ConversionNode) node).operand), node.getType());
            case SAVE: {
                if (saved.containsKey(index)) {
                    return saved.get(index);
                }
                Object value = evaluate(((SaveNode) node).operand);
                saved.put(index, value);
                return value;
            }
            case CALL:
                return call((CallNode) node);
            case LOCAL_REF: {
                SyntheticLocal local = ((LocalRefNode) node).local;
                Object value = local(local);
                if (value instanceof char[]) {
                    return environment.string(contents((char[]) value));
                }
                return value;
            }
            default:
                if (node.getKind().isBinary()) {
                    return binary((BinaryNode) node);
                }
                throw new IllegalStateException("Node " + index + " of kind " + node.getKind()
                        + " does not produce a value");
        }
    }

    public static boolean isTrue(Object value) {
        if (value instanceof Long) {
            return (Long) value != 0L;
        }
        if (value instanceof CPointer) {
            return !((CPointer) value).isNull();
        }
        if (value instanceof Double) {
            return (Double) value != 0.0;
        }
        throw new IllegalStateException("Value " + value + " has no truth value");
    }

    private Object binary(BinaryNode node) {
        NodeKind kind = node.getKind();
        if (kind.isLogical()) {
            boolean left = isTrue(evaluate(node.left));
            if (kind == NodeKind.TRUTH_ANDIF && !left) {
                return 0L;
            }
            if (kind == NodeKind.TRUTH_ORIF && left) {
                return 1L;
            }
            boolean right = isTrue(evaluate(node.right));
            return (kind.isConjunction() ? left && right : left || right) ? 1L : 0L;
        }
        Object left = evaluate(node.left);
        Object right = evaluate(node.right);
        if (kind.getCategory() == NodeKind.Category.RELATIONAL) {
            boolean unsigned = arena.type(node.left).canonical().isUnsigned()
                    || arena.type(node.right).canonical().isUnsigned();
            int cmp = compare(left, right, unsigned);
            switch (kind) {
                case EQ:
                    return cmp == 0 ? 1L : 0L;
                case NE:
                    return cmp != 0 ? 1L : 0L;
                case LT:
                    return cmp < 0 ? 1L : 0L;
                case LE:
                    return cmp <= 0 ? 1L : 0L;
                case GT:
                    return cmp > 0 ? 1L : 0L;
                default:
                    return cmp >= 0 ? 1L : 0L;
            }
        }
        return arithmetic(kind, node.getType(), left, right);
    }

    private int compare(Object left, Object right, boolean unsigned) {
        if (left instanceof CPointer || right instanceof CPointer) {
            return Long.compareUnsigned(address(left), address(right));
        }
        if (left instanceof Double || right instanceof Double) {
            return Double.compare(toDouble(left), toDouble(right));
        }
        long l = (Long) left;
        long r = (Long) right;
        return unsigned ? Long.compareUnsigned(l, r) : Long.compare(l, r);
    }

    private Object arithmetic(NodeKind kind, CType type, Object left, Object right) {
        if (left instanceof CPointer || right instanceof CPointer) {
            throw new IllegalStateException("Pointer arithmetic (" + kind + ") is not supported");
        }
        if (left instanceof Double || right instanceof Double) {
            double l = toDouble(left);
            double r = toDouble(right);
            switch (kind) {
                case PLUS:
                    return l + r;
                case MINUS:
                    return l - r;
                case MULT:
                    return l * r;
                case TRUNC_DIV:
                    return l / r;
                default:
                    throw new IllegalStateException("Operator " + kind + " is not defined for floating values");
            }
        }
        long l = (Long) left;
        long r = (Long) right;
        boolean unsigned = type.canonical().isUnsigned();
        long result;
        switch (kind) {
            case PLUS:
                result = l + r;
                break;
            case MINUS:
                result = l - r;
                break;
            case MULT:
                result = l * r;
                break;
            case TRUNC_DIV:
                result = unsigned ? Long.divideUnsigned(l, r) : l / r;
                break;
            case TRUNC_MOD:
                result = unsigned ? Long.remainderUnsigned(l, r) : l % r;
                break;
            case BIT_AND:
                result = l & r;
                break;
            case BIT_IOR:
                result = l | r;
                break;
            case BIT_XOR:
                result = l ^ r;
                break;
            case LSHIFT:
                result = l << r;
                break;
            case RSHIFT:
                result = unsigned ? l >>> r : l >> r;
                break;
            default:
                throw new IllegalStateException("Not an arithmetic operator: " + kind);
        }
        return normalize(result, type);
    }

    private Object call(CallNode node) {
        List<Object> arguments = new ArrayList<>(node.argumentCount());
        for (int i = 0; i < node.argumentCount(); i++) {
            arguments.add(evaluate(node.argument(i)));
        }
        String name = node.function.getName();
        CFunction function = environment.function(name);
        if (function != null) {
            return convert(function.invoke(arguments), node.getType());
        }
        switch (name) {
            case PRINTF: {
                String text = CFormatter.format(string(arguments.get(0)), arguments.subList(1, arguments.size()));
                environment.print(text);
                return (long) text.length();
            }
            case ABORT:
                throw new AbortException("abort() called");
            case ASSERT_FAIL: {
                String message = string(arguments.get(1)) + ":" + arguments.get(2) + ": "
                        + string(arguments.get(3)) + ": Assertion `" + string(arguments.get(0)) + "' failed.";
                environment.printError(message + "\n");
                throw new AbortException(message);
            }
            default:
                throw new IllegalStateException("No implementation for function '" + name + "'");
        }
    }

    private void appendToBuffer(BufferAppendNode node) {
        char[] buffer = (char[]) local(node.buffer.getBuffer());
        int cursor = (int) (long) (Long) local(node.buffer.getCursor());
        List<Object> arguments = new ArrayList<>(node.argumentCount());
        for (int i = 0; i < node.argumentCount(); i++) {
            arguments.add(evaluate(node.argument(i)));
        }
        String text = CFormatter.format(node.format, arguments);
        int room = buffer.length - cursor;
        int written = Math.min(text.length(), room - 1);
        text.getChars(0, written, buffer, cursor);
        buffer[cursor + written] = '\0';
        cursor += text.length();
        if (cursor >= buffer.length) {
            cursor = buffer.length - 1;
        }
        locals.put(node.buffer.getCursor(), (long) cursor);
    }

    private Object local(SyntheticLocal local) {
        Object value = locals.get(local);
        if (value == null) {
            throw new IllegalStateException("Local '" + local.getName() + "' is used before its declaration");
        }
        return value;
    }

    private Object toValue(Object argument) {
        if (argument instanceof Integer) {
            return ((Integer) argument).longValue();
        }
        if (argument instanceof String) {
            return environment.string((String) argument);
        }
        return argument;
    }

    static Object convert(Object value, CType target) {
        CType type = target.canonical();
        switch (type.getKind()) {
            case VOID:
                return null;
            case POINTER:
                if (value instanceof CPointer) {
                    return value;
                }
                long address = address(value);
                return address == 0L ? CPointer.NULL : new CPointer(address, null);
            case BOOLEAN:
                return isTrue(value) ? 1L : 0L;
            case REAL:
                return toDouble(value);
            case INTEGER:
            case ENUM:
                if (value instanceof Double) {
                    return normalize((long) (double) (Double) value, type);
                }
                return normalize(address(value), type);
            default:
                throw new IllegalStateException("Values of type " + target + " are not supported");
        }
    }

    static long normalize(long value, CType type) {
        CType canonical = type.canonical();
        if (canonical.getKind() == CType.Kind.BOOLEAN) {
            return value != 0L ? 1L : 0L;
        }
        int precision = canonical.getPrecision();
        if (precision <= 0 || precision >= 64) {
            return value;
        }
        long mask = (1L << precision) - 1;
        long truncated = value & mask;
        if (!canonical.isUnsigned() && (truncated & (1L << (precision - 1))) != 0) {
            truncated |= ~mask;
        }
        return truncated;
    }

    private static long address(Object value) {
        if (value instanceof CPointer) {
            return ((CPointer) value).getAddress();
        }
        if (value instanceof Long) {
            return (Long) value;
        }
        throw new IllegalStateException("Value " + value + " is not an integer or pointer");
    }

    private static double toDouble(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Long) {
            return (Long) value;
        }
        throw new IllegalStateException("Value " + value + " is not numeric");
    }

    private static String string(Object value) {
        if (!(value instanceof CPointer) || ((CPointer) value).getTarget() == null) {
            throw new IllegalStateException("Expected a string, got " + value);
        }
        return ((CPointer) value).getTarget();
    }

    private static String contents(char[] buffer) {
        int end = 0;
        while (end < buffer.length && buffer[end] != '\0') {
            end++;
        }
        return new String(buffer, 0, end);
    }
}
