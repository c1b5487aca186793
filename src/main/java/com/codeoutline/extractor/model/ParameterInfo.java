package com.codeoutline.extractor.model;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of a callable's parameter list, split from the raw tokens.
 * No type resolution is performed: {@code type} is the written text.
 */
@Value
@Builder
public class ParameterInfo {
    /** Parameter name, or null when the declaration leaves it unnamed. */
    String name;
    String type;
    String defaultValue;
    boolean variadic;

    public boolean isOptional() {
        return defaultValue != null;
    }
}
