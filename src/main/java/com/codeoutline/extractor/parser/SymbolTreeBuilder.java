package com.codeoutline.extractor.parser;

import com.codeoutline.extractor.model.Scope;
import com.codeoutline.extractor.model.ScopeKind;
import com.codeoutline.extractor.model.Symbol;

/**
 * Assembles the symbol tree from scope and symbol events.
 *
 * Symbols are attached to the scope they were recognized in; a scope backed
 * by a container symbol forwards them to it. When such a scope closes, its
 * symbol is sealed. Anonymous namespaces and linkage blocks have no symbol of
 * their own, so on close their contents move up to the enclosing scope.
 */
public class SymbolTreeBuilder implements ScopeListener {

    @Override
    public void onSymbol(Symbol symbol, Scope scope) {
        scope.addSymbol(symbol);
    }

    @Override
    public void onScopePop(Scope scope) {
        Symbol owner = scope.getOwner();
        if (owner != null) {
            if (owner.getKind().isContainer()) {
                owner.seal(scope.getEndOffset(), scope.getEndLine());
            }
            return;
        }
        if (scope.getKind() == ScopeKind.NAMESPACE && scope.isAnonymous() && scope.getParent() != null) {
            for (Symbol symbol : scope.getSymbols()) {
                scope.getParent().addSymbol(symbol);
            }
        }
    }
}
