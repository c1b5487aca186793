package com.codeoutline.extractor.config;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for a single parse.
 */
@Value
@Builder
public class ParserOptions {

    public static final int DEFAULT_MAX_HEADER_TOKENS = 1024;

    /**
     * Which comment runs qualify as documentation.
     */
    @Builder.Default
    DocumentationPolicy documentationPolicy = DocumentationPolicy.ANY_COMMENT;

    /**
     * Upper bound on the tokens gathered for one declaration header. A longer
     * header is treated as unrecognizable and skipped.
     */
    @Builder.Default
    int maxHeaderTokens = DEFAULT_MAX_HEADER_TOKENS;

    /**
     * Whether to count decision points while skipping function bodies.
     */
    @Builder.Default
    boolean computeComplexity = true;

    public static ParserOptions defaults() {
        return ParserOptions.builder().build();
    }
}
