package org.introspect.rewriter;

import org.introspect.tree.BufferDescriptor;
import org.introspect.tree.FunctionDecl;
import org.introspect.tree.NodeArena;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects report statements for one branch. Consecutive text and values meant for the same buffer are
 * merged into a single formatted append.
 */
final class ReportBuilder {
    private final NodeArena arena;
    private final BufferDescriptor buffer;
    private final FunctionDecl formatter;
    private final List<Integer> statements = new ArrayList<>();
    private final StringBuilder format = new StringBuilder();
    private final List<Integer> arguments = new ArrayList<>();

    ReportBuilder(NodeArena arena, BufferDescriptor buffer, FunctionDecl formatter) {
        this.arena = arena;
        this.buffer = buffer;
        this.formatter = formatter;
    }

    ReportBuilder text(String text) {
        format.append(FormatPlan.escape(text));
        return this;
    }

    /**
     * Appends a conversion, already escaped, together with the node that supplies its value.
     */
    ReportBuilder value(String conversion, int argument) {
        format.append(conversion);
        arguments.add(argument);
        return this;
    }

    ReportBuilder statement(int statement) {
        flush();
        statements.add(statement);
        return this;
    }

    ReportBuilder branch() {
        return new ReportBuilder(arena, buffer, formatter);
    }

    int toBlock() {
        flush();
        return arena.block(statements);
    }

    List<Integer> build() {
        flush();
        return new ArrayList<>(statements);
    }

    private void flush() {
        if (format.length() == 0) {
            return;
        }
        int[] values = new int[arguments.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = arguments.get(i);
        }
        statements.add(arena.append(buffer, formatter, format.toString(), values));
        format.setLength(0);
        arguments.clear();
    }
}
