package com.codeoutline.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A nesting context opened by a brace (or, for template parameter lists, an
 * angle bracket). The root scope has kind {@link ScopeKind#FILE} and no parent.
 *
 * A scope backed by a namespace or type declaration forwards every symbol
 * added to it to that declaration's symbol, so the symbol tree is built as the
 * scopes fill up.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Scope {
    private final ScopeKind kind;
    private final String name;
    private final String fileName;
    private final int startOffset;
    private int endOffset;
    private int endLine;
    private List<Symbol> symbols = new ArrayList<>();
    private boolean sealed;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Scope parent;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Symbol owner;

    /** Access level applied to members declared next; only meaningful for type scopes. */
    @Setter
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Visibility currentVisibility;

    private Scope(ScopeKind kind, String name, String fileName, Scope parent, Symbol owner,
                  int startOffset, Visibility currentVisibility) {
        this.kind = kind;
        this.name = name != null ? name : "";
        this.fileName = fileName;
        this.parent = parent;
        this.owner = owner;
        this.startOffset = startOffset;
        this.endOffset = startOffset;
        this.currentVisibility = currentVisibility;
    }

    public static Scope root(String fileName) {
        return new Scope(ScopeKind.FILE, "", fileName, null, null, 0, Visibility.UNSPECIFIED);
    }

    /**
     * Opens a child scope. The parent is fixed here and never reassigned.
     */
    public Scope open(ScopeKind childKind, String childName, Symbol childOwner, int offset) {
        Visibility visibility = Visibility.UNSPECIFIED;
        if (childKind == ScopeKind.TYPE && childOwner != null && childOwner.getKind() != SymbolKind.ENUM) {
            visibility = Visibility.defaultFor(childOwner.getClassKey());
        }
        return new Scope(childKind, childName, fileName, this, childOwner, offset, visibility);
    }

    public void addSymbol(Symbol symbol) {
        if (sealed) {
            throw new IllegalStateException("Scope " + getPath() + " is sealed");
        }
        symbols.add(symbol);
        if (owner != null) {
            owner.addChild(symbol);
        }
    }

    public void seal(int endOffset, int endLine) {
        this.endOffset = endOffset;
        this.endLine = endLine;
        this.symbols = Collections.unmodifiableList(symbols);
        this.sealed = true;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isAnonymous() {
        return name.isEmpty();
    }

    public SourceSpan getSpan() {
        return SourceSpan.of(startOffset, endOffset);
    }

    /**
     * Simple name of the type this scope belongs to, used to spot constructors
     * and destructors. Empty for non-type scopes.
     */
    public String getTypeName() {
        if (kind != ScopeKind.TYPE) {
            return "";
        }
        int sep = name.lastIndexOf("::");
        return sep >= 0 ? name.substring(sep + 2) : name;
    }

    /**
     * Names of the enclosing scopes from the root down, including this one.
     */
    public List<String> getPath() {
        List<String> path = new ArrayList<>();
        for (Scope s = this; s != null && !s.isRoot(); s = s.parent) {
            path.add(0, s.name);
        }
        return path;
    }
}
