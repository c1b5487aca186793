package com.codeoutline.extractor.parser;

import java.util.List;
import java.util.Set;

import com.codeoutline.extractor.model.ParameterInfo;
import com.codeoutline.extractor.model.SymbolKind;

import lombok.Builder;
import lombok.Value;

/**
 * What the recognizer made of one declaration header, before it is placed in
 * the tree.
 */
@Value
@Builder
public class Declaration {
    SymbolKind kind;
    String name;
    String signature;
    String returnType;
    List<ParameterInfo> parameters;
    Set<String> modifiers;
    List<String> baseClasses;
    String classKey;
    String templateParameters;
    String value;
    boolean declarationOnly;
    /** Anonymous namespace or linkage block: opens a scope without a symbol. */
    boolean anonymousScope;
}
