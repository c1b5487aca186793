package com.codeoutline.extractor.model;

/**
 * Nesting contexts tracked while walking the token stream.
 */
public enum ScopeKind {
    FILE,
    NAMESPACE,
    TYPE,
    FUNCTION,
    TEMPLATE_PARAMETER_LIST
}
