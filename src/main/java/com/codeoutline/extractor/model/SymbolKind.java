package com.codeoutline.extractor.model;

/**
 * Kinds of declarations the extractor recognizes.
 */
public enum SymbolKind {
    NAMESPACE,
    CLASS,
    STRUCT,
    ENUM,
    ENUMERATOR,
    FUNCTION,
    METHOD,
    CONSTRUCTOR,
    DESTRUCTOR,
    FIELD,
    TEMPLATE_FUNCTION,
    TEMPLATE_CLASS;

    /**
     * Whether symbols of this kind own child symbols.
     */
    public boolean isContainer() {
        return this == NAMESPACE || isType();
    }

    public boolean isType() {
        return this == CLASS || this == STRUCT || this == ENUM || this == TEMPLATE_CLASS;
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD || this == CONSTRUCTOR ||
               this == DESTRUCTOR || this == TEMPLATE_FUNCTION;
    }
}
