package com.codeoutline.extractor.parser;

import com.codeoutline.extractor.model.Scope;
import com.codeoutline.extractor.model.Symbol;

/**
 * Receives the ordered scope-push, scope-pop and symbol events of a parse.
 */
public interface ScopeListener {

    default void onScopePush(Scope scope) {
    }

    /**
     * Called after the scope has been sealed.
     */
    default void onScopePop(Scope scope) {
    }

    /**
     * Called when a declaration is recognized inside {@code scope}.
     */
    default void onSymbol(Symbol symbol, Scope scope) {
    }
}
