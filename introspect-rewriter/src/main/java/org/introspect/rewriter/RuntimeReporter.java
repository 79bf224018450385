package org.introspect.rewriter;

import org.introspect.tree.AbstractNode;
import org.introspect.tree.BinaryNode;
import org.introspect.tree.ConversionNode;
import org.introspect.tree.FunctionDecl;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.SaveNode;
import org.introspect.tree.SyntheticLocal;
import org.introspect.tree.VarRefNode;

/**
 * Generates the statements that write the evaluated part of a failed condition into the expression buffer.
 * The generated branches follow the evaluation order of the condition, so operands that were skipped by
 * short-circuiting never show up in the report and are never evaluated by it.
 */
public final class RuntimeReporter {
    static final String SKIPPED = "(...)";

    private final NodeArena arena;
    private final AssertionScope scope;
    private final FunctionDecl formatter;
    private final FormatResolver formats;
    private final CallArgumentReporter calls;

    public RuntimeReporter(NodeArena arena, AssertionScope scope, FunctionDecl formatter,
                           StaticReconstructor reconstructor) {
        this.arena = arena;
        this.scope = scope;
        this.formatter = formatter;
        this.formats = new FormatResolver(arena);
        this.calls = new CallArgumentReporter(arena, scope, formatter, formats, reconstructor, this);
    }

    /**
     * Builder for statements writing into the expression buffer.
     */
    ReportBuilder newBuilder() {
        return new ReportBuilder(arena, scope.getExpressionBuffer(), formatter);
    }

    /**
     * Adds the report of a wrapped condition node to the builder.
     */
    void report(int index, ReportBuilder out) {
        int node = EntityIdentity.unwrap(arena, index);
        AbstractNode unwrapped = arena.get(node);
        switch (unwrapped.getKind()) {
            case CALL:
                calls.report(index, out);
                return;
            case VAR_REF:
                reportVariable(index, out);
                return;
            case INTEGER_CST:
            case STRING_CST:
            case ADDR:
                out.value(formats.resolve(index).render(null), index);
                return;
            default:
                if (unwrapped.getKind().isLogical()) {
                    reportLogical((BinaryNode) unwrapped, out);
                } else if (unwrapped.getKind().isBinary()) {
                    reportBinary((BinaryNode) unwrapped, out);
                } else {
                    throw new IllegalStateException("Node " + node + " of kind " + unwrapped.getKind()
                            + " cannot appear in a wrapped assertion condition");
                }
        }
    }

    private void reportLogical(BinaryNode logical, ReportBuilder out) {
        switch (logical.getKind()) {
            case TRUTH_ANDIF: {
                ReportBuilder rightFailed = out.branch().text(SKIPPED + " && (");
                report(logical.right, rightFailed);
                rightFailed.text(")");
                ReportBuilder leftFailed = out.branch();
                report(logical.left, leftFailed);
                out.statement(arena.conditional(logical.left, rightFailed.toBlock(), leftFailed.toBlock()));
                return;
            }
            case TRUTH_AND: {
                // both operands were evaluated: show each failing one
                ReportBuilder rightFailed = out.branch().text(SKIPPED + " && (");
                report(logical.right, rightFailed);
                rightFailed.text(")");
                ReportBuilder leftFailed = out.branch().text("(");
                report(logical.left, leftFailed);
                leftFailed.text(") && " + SKIPPED);
                ReportBuilder bothFailed = out.branch().text("(");
                report(logical.left, bothFailed);
                bothFailed.text(") && (");
                report(logical.right, bothFailed);
                bothFailed.text(")");
                int leftTrue = rightFailed.toBlock();
                int leftFalse = arena.conditional(logical.right, leftFailed.toBlock(), bothFailed.toBlock());
                out.statement(arena.conditional(logical.left, leftTrue, leftFalse));
                return;
            }
            case TRUTH_ORIF: {
                // a true left side means the right one was never evaluated
                ReportBuilder leftPassed = out.branch().text("(");
                report(logical.left, leftPassed);
                leftPassed.text(") || " + SKIPPED);
                ReportBuilder bothEvaluated = out.branch();
                reportBoth(logical, bothEvaluated);
                out.statement(arena.conditional(logical.left, leftPassed.toBlock(), bothEvaluated.toBlock()));
                return;
            }
            default:
                reportBoth(logical, out);
        }
    }

    private void reportBoth(BinaryNode logical, ReportBuilder out) {
        out.text("(");
        report(logical.left, out);
        out.text(") " + logical.getKind().getOperator() + " (");
        report(logical.right, out);
        out.text(")");
    }

    private void reportBinary(BinaryNode binary, ReportBuilder out) {
        reportChild(binary.left, binary.getKind(), false, out);
        out.text(" " + binary.getKind().getOperator() + " ");
        reportChild(binary.right, binary.getKind(), true, out);
    }

    private void reportChild(int child, NodeKind parent, boolean right, ReportBuilder out) {
        if (StaticReconstructor.needsParentheses(arena, child, parent, right)) {
            out.text("(");
            report(child, out);
            out.text(")");
        } else {
            report(child, out);
        }
    }

    private void reportVariable(int index, ReportBuilder out) {
        Color color = scope.getColors().assign(EntityIdentity.of(arena, index));
        out.statement(variableLine(leafHandle(arena, index)));
        out.value(formats.resolve(index).render(color), index);
    }

    /**
     * Statement writing {@code name = value} for a variable into the subexpressions buffer, once per
     * variable no matter how often it is reached.
     */
    int variableLine(int handle) {
        VarRefNode variable = arena.get(EntityIdentity.unwrap(arena, handle), VarRefNode.class);
        Color color = scope.getColors().assign(EntityIdentity.of(arena, handle));
        SyntheticLocal flag = scope.flagFor(variable.decl);
        String format = "  " + FormatPlan.escape(Color.paint(color, variable.decl.getName())) + " = "
                + formats.resolve(handle).render(null) + "\n";
        int write = arena.append(scope.getSubexpressionBuffer(), formatter, format, handle);
        return arena.conditional(arena.reference(flag), arena.nop(), arena.block(arena.setFlag(flag), write));
    }

    /**
     * The handle directly around a variable or call, skipping the conversions above it.
     */
    static int leafHandle(NodeArena arena, int index) {
        int node = index;
        while (true) {
            NodeKind kind = arena.kind(node);
            if (kind == NodeKind.SAVE) {
                int operand = arena.get(node, SaveNode.class).operand;
                NodeKind inner = arena.kind(operand);
                if (inner == NodeKind.VAR_REF || inner == NodeKind.CALL) {
                    return node;
                }
                node = operand;
            } else if (kind == NodeKind.CONVERT) {
                node = arena.get(node, ConversionNode.class).operand;
            } else {
                return node;
            }
        }
    }
}
