package org.introspect.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One source file as handed over by the host front end: the node arena, every function declaration visible in
 * the file and the function bodies defined in it.
 */
public final class TranslationUnit {
    private final String fileName;
    private final NodeArena arena;
    private final Map<String, FunctionDecl> declarations = new LinkedHashMap<>();
    private final List<FunctionDefinition> definitions = new ArrayList<>();

    public TranslationUnit(String fileName) {
        this(fileName, new NodeArena());
    }

    public TranslationUnit(String fileName, NodeArena arena) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.arena = Objects.requireNonNull(arena, "arena");
    }

    public String getFileName() {
        return fileName;
    }

    public NodeArena getArena() {
        return arena;
    }

    public FunctionDecl declare(FunctionDecl decl) {
        FunctionDecl existing = declarations.putIfAbsent(decl.getName(), decl);
        return existing != null ? existing : decl;
    }

    public FunctionDefinition define(FunctionDecl decl, List<VarDecl> parameters, int body) {
        FunctionDefinition definition = new FunctionDefinition(declare(decl), parameters, body);
        definitions.add(definition);
        return definition;
    }

    /**
     * @return the declaration with the given name or null if the file never declares it
     */
    public FunctionDecl findFunction(String name) {
        return declarations.get(name);
    }

    public FunctionDefinition findDefinition(String name) {
        for (FunctionDefinition definition : definitions) {
            if (definition.getName().equals(name)) {
                return definition;
            }
        }
        return null;
    }

    public List<FunctionDecl> getDeclarations() {
        return Collections.unmodifiableList(new ArrayList<>(declarations.values()));
    }

    public List<FunctionDefinition> getDefinitions() {
        return Collections.unmodifiableList(definitions);
    }
}
