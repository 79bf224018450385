package org.introspect.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class FunctionDecl {
    private final String name;
    private final CType returnType;
    private final List<CType> parameterTypes;
    private final boolean variadic;

    public FunctionDecl(String name, CType returnType, List<CType> parameterTypes, boolean variadic) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
        this.variadic = variadic;
    }

    public static FunctionDecl of(String name, CType returnType, CType... parameterTypes) {
        List<CType> params = new ArrayList<>();
        Collections.addAll(params, parameterTypes);
        return new FunctionDecl(name, returnType, params, false);
    }

    public static FunctionDecl variadic(String name, CType returnType, CType... parameterTypes) {
        List<CType> params = new ArrayList<>();
        Collections.addAll(params, parameterTypes);
        return new FunctionDecl(name, returnType, params, true);
    }

    public String getName() {
        return name;
    }

    public CType getReturnType() {
        return returnType;
    }

    public List<CType> getParameterTypes() {
        return parameterTypes;
    }

    public boolean isVariadic() {
        return variadic;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(returnType.declare(name)).append('(');
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(parameterTypes.get(i).displayName());
        }
        if (variadic) {
            sb.append(parameterTypes.isEmpty() ? "..." : ", ...");
        }
        return sb.append(')').toString();
    }
}
