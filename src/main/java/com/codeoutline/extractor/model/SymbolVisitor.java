package com.codeoutline.extractor.model;

/**
 * Visitor for traversing the symbol tree. Unimplemented callbacks do nothing.
 */
public interface SymbolVisitor {
    default void visitNamespace(Symbol namespace) {
    }

    default void visitType(Symbol type) {
    }

    default void visitEnumerator(Symbol enumerator) {
    }

    default void visitCallable(Symbol callable) {
    }

    default void visitField(Symbol field) {
    }
}
