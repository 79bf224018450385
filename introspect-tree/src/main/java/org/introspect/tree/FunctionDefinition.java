package org.introspect.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class FunctionDefinition {
    private final FunctionDecl decl;
    private final List<VarDecl> parameters;
    private int body;

    public FunctionDefinition(FunctionDecl decl, List<VarDecl> parameters, int body) {
        this.decl = Objects.requireNonNull(decl, "decl");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        if (parameters.size() != decl.getParameterTypes().size()) {
            throw new IllegalArgumentException("Function '" + decl.getName() + "' declares "
                    + decl.getParameterTypes().size() + " parameters but " + parameters.size() + " were given");
        }
        this.body = body;
    }

    public FunctionDecl getDecl() {
        return decl;
    }

    public String getName() {
        return decl.getName();
    }

    public List<VarDecl> getParameters() {
        return parameters;
    }

    public int getBody() {
        return body;
    }

    public void setBody(int body) {
        this.body = body;
    }
}
