package org.introspect.runtime;

import org.introspect.tree.VarDecl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simulated process state for {@link TreeInterpreter}: variable bindings, function implementations, a fake
 * address space and the captured standard output and error streams.
 */
public final class Environment {
    private static final long ADDRESS_BASE = 0x55550000L;
    private static final long ADDRESS_STEP = 0x10L;

    private final Map<VarDecl, Object> values = new IdentityHashMap<>();
    private final Map<VarDecl, Long> addresses = new IdentityHashMap<>();
    private final Map<Integer, CPointer> stringConstants = new HashMap<>();
    private final Map<String, CFunction> functions = new HashMap<>();
    private final StringBuilder out = new StringBuilder();
    private final StringBuilder err = new StringBuilder();
    private long nextAddress = ADDRESS_BASE;

    public Environment bind(VarDecl decl, Object value) {
        values.put(decl, value);
        return this;
    }

    public Environment bind(VarDecl decl, long value) {
        return bind(decl, Long.valueOf(value));
    }

    public Object value(VarDecl decl) {
        if (!values.containsKey(decl)) {
            throw new IllegalStateException("Variable '" + decl.getName() + "' is not bound");
        }
        return values.get(decl);
    }

    public Environment define(String name, CFunction function) {
        functions.put(name, function);
        return this;
    }

    public CFunction function(String name) {
        return functions.get(name);
    }

    /**
     * Allocates a string in the simulated address space.
     */
    public CPointer string(String value) {
        return new CPointer(allocate(), value);
    }

    CPointer stringConstant(int node, String value) {
        CPointer pointer = stringConstants.get(node);
        if (pointer == null) {
            pointer = string(value);
            stringConstants.put(node, pointer);
        }
        return pointer;
    }

    CPointer addressOf(VarDecl decl) {
        Long address = addresses.get(decl);
        if (address == null) {
            address = allocate();
            addresses.put(decl, address);
        }
        return new CPointer(address, null);
    }

    private long allocate() {
        long address = nextAddress;
        nextAddress += ADDRESS_STEP;
        return address;
    }

    void print(String text) {
        out.append(text);
    }

    void printError(String text) {
        err.append(text);
    }

    public String getOutput() {
        return out.toString();
    }

    public List<String> getOutputLines() {
        return lines(out);
    }

    public String getErrorOutput() {
        return err.toString();
    }

    public List<String> getErrorLines() {
        return lines(err);
    }

    private static List<String> lines(StringBuilder text) {
        if (text.length() == 0) {
            return new ArrayList<>();
        }
        String content = text.toString();
        if (content.endsWith("\n")) {
            content = content.substring(0, content.length() - 1);
        }
        return new ArrayList<>(Arrays.asList(content.split("\n", -1)));
    }
}
