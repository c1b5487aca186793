package com.codeoutline.extractor.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of parsing one source text: the root scope holding the symbol tree,
 * plus diagnostics for anything that had to be skipped or repaired.
 */
@Value
@Builder
public class ParseResult {
    String fileName;
    Scope root;
    ParseDiagnostics diagnostics;
    int tokenCount;

    /** Includes and using declarations in file order. */
    @Builder.Default
    List<ImportDirective> imports = List.of();

    /**
     * All symbols in file order, parents before their children.
     */
    public List<Symbol> getAllSymbols() {
        List<Symbol> all = new ArrayList<>();
        for (Symbol symbol : root.getSymbols()) {
            collect(symbol, all);
        }
        return all;
    }

    private void collect(Symbol symbol, List<Symbol> all) {
        all.add(symbol);
        for (Symbol child : symbol.getChildren()) {
            collect(child, all);
        }
    }

    /**
     * Find every symbol with the given simple name.
     */
    public List<Symbol> findSymbols(String name) {
        return getAllSymbols().stream().filter(s -> s.getName().equals(name)).toList();
    }

    /**
     * Find a symbol by its {@code ::}-joined qualified name.
     */
    public Optional<Symbol> findByQualifiedName(String qualifiedName) {
        return getAllSymbols().stream()
                .filter(s -> s.getQualifiedName().equals(qualifiedName))
                .findFirst();
    }

    public List<Symbol> getSymbolsOfKind(SymbolKind kind) {
        return getAllSymbols().stream().filter(s -> s.getKind() == kind).toList();
    }

    /**
     * Visit every symbol in file order.
     */
    public void accept(SymbolVisitor visitor) {
        for (Symbol symbol : getAllSymbols()) {
            symbol.accept(visitor);
        }
    }

    public List<ImportDirective> getImportsOfKind(ImportDirective.Kind kind) {
        return imports.stream().filter(i -> i.getKind() == kind).toList();
    }

    public boolean isEmpty() {
        return root.getSymbols().isEmpty();
    }
}
