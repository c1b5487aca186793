package com.codeoutline.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One recognized declaration. Container kinds (namespaces and types) own an
 * ordered list of child symbols, sealed when the closing brace is reached.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Symbol {
    private final SymbolKind kind;
    private String name;
    private final Visibility visibility;
    /** Raw parameter list for callables, raw declaration text otherwise. */
    private final String signature;
    private final DocumentationBlock documentation;
    private final String returnType;
    private final List<ParameterInfo> parameters;
    private final Set<String> modifiers;
    private final String templateParameters;
    private final List<String> baseClasses;
    private final String classKey;
    /** Enumerator initializer, kept verbatim. */
    private final String value;
    private final boolean declarationOnly;
    private final int startLine;

    private SourceSpan span;
    private int endLine;
    private int complexity;
    private boolean sealed;
    private List<Symbol> children = new ArrayList<>();

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Symbol parent;

    @Builder
    public Symbol(SymbolKind kind, String name, Visibility visibility, String signature,
                  DocumentationBlock documentation, String returnType, List<ParameterInfo> parameters,
                  Set<String> modifiers, String templateParameters, List<String> baseClasses,
                  String classKey, String value, boolean declarationOnly, SourceSpan span,
                  int startLine, int endLine, int complexity) {
        this.kind = kind;
        this.name = name != null ? name : "";
        this.visibility = visibility != null ? visibility : Visibility.UNSPECIFIED;
        this.signature = signature != null ? signature : "";
        this.documentation = documentation;
        this.returnType = returnType;
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.modifiers = modifiers != null ? Collections.unmodifiableSet(new LinkedHashSet<>(modifiers)) : Set.of();
        this.templateParameters = templateParameters;
        this.baseClasses = baseClasses != null ? List.copyOf(baseClasses) : List.of();
        this.classKey = classKey;
        this.value = value;
        this.declarationOnly = declarationOnly;
        this.span = span;
        this.startLine = startLine;
        this.endLine = endLine > 0 ? endLine : startLine;
        this.complexity = complexity;
        // leaf symbols are complete as soon as they are built
        this.sealed = !kind.isContainer() || declarationOnly;
    }

    public void addChild(Symbol child) {
        if (sealed) {
            throw new IllegalStateException("Symbol " + getQualifiedName() + " is sealed");
        }
        children.add(child);
        child.parent = this;
    }

    /**
     * Closes the symbol: records where it ends and freezes its child list.
     */
    public void seal(int endOffset, int endLine) {
        if (sealed) {
            return;
        }
        this.span = SourceSpan.of(span.getStartOffset(), endOffset);
        this.endLine = endLine;
        this.children = Collections.unmodifiableList(children);
        this.sealed = true;
    }

    /**
     * Names a type declared without one, as in {@code typedef struct { ... } Point;}.
     */
    public void assignName(String typedefName) {
        if (!name.isEmpty()) {
            throw new IllegalStateException("Symbol " + getQualifiedName() + " already has a name");
        }
        this.name = typedefName;
    }

    /**
     * Extends the span of a callable whose body has just been skipped.
     */
    public void completeBody(int endOffset, int endLine, int complexity) {
        if (!kind.isCallable()) {
            throw new IllegalStateException("Only callables have bodies: " + kind);
        }
        this.span = SourceSpan.of(span.getStartOffset(), endOffset);
        this.endLine = endLine;
        this.complexity = complexity;
    }

    /**
     * Names of the enclosing symbols from the outermost down, recomputed from
     * the parent links on every call. Unnamed types contribute nothing.
     */
    public List<String> getQualifiedPath() {
        List<String> path = new ArrayList<>();
        for (Symbol p = parent; p != null; p = p.parent) {
            if (!p.name.isEmpty()) {
                path.add(0, p.name);
            }
        }
        return path;
    }

    public String getQualifiedName() {
        List<String> path = getQualifiedPath();
        path.add(name);
        return String.join("::", path);
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }

    public boolean hasDocumentation() {
        return documentation != null;
    }

    public List<Symbol> getChildrenOfKind(SymbolKind childKind) {
        return children.stream().filter(c -> c.kind == childKind).toList();
    }

    public void accept(SymbolVisitor visitor) {
        switch (kind) {
            case NAMESPACE -> visitor.visitNamespace(this);
            case CLASS, STRUCT, ENUM, TEMPLATE_CLASS -> visitor.visitType(this);
            case ENUMERATOR -> visitor.visitEnumerator(this);
            case FIELD -> visitor.visitField(this);
            default -> visitor.visitCallable(this);
        }
    }
}
